package io.mnemo.core.filter;

import java.util.Map;

public sealed interface Condition permits MatchValue, MatchAny {

    String key();

    boolean test(Map<String, ?> payload);
}
