package io.mnemo.core.vector;

import java.util.Objects;

public record CollectionSchema(int denseDimensions, Distance distance, boolean sparseEnabled) {
    public static final String DENSE_VECTOR = "text-dense";
    public static final String SPARSE_VECTOR = "text-sparse";

    public CollectionSchema {
        if (denseDimensions <= 0) {
            throw new IllegalArgumentException("denseDimensions must be positive: " + denseDimensions);
        }
        Objects.requireNonNull(distance, "distance must not be null");
    }
}
