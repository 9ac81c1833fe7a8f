package io.mnemo.core.retrieval;

import java.util.Map;

public record FusedHit(String id, double score, int lists, Map<String, Object> payload) {
}
