package io.mnemo.core.vector;

import io.mnemo.core.embedding.SparseVector;
import java.util.Map;
import java.util.Objects;

public record VectorPoint(String id, float[] dense, SparseVector sparse, Map<String, Object> payload) {

    public VectorPoint {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(dense, "dense must not be null");
        sparse = sparse == null ? SparseVector.empty() : sparse;
        payload = payload == null ? Map.of() : payload;
    }
}
