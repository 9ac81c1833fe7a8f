package io.mnemo.core.embedding;

import java.util.Arrays;
import java.util.Objects;

public record SparseVector(int[] indices, float[] values) {
    private static final SparseVector EMPTY = new SparseVector(new int[0], new float[0]);

    public SparseVector {
        Objects.requireNonNull(indices, "indices must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (indices.length != values.length) {
            throw new IllegalArgumentException(
                "indices and values must have the same length: " + indices.length + " != " + values.length
            );
        }
        for (int i = 1; i < indices.length; i++) {
            if (indices[i] <= indices[i - 1]) {
                throw new IllegalArgumentException("indices must be strictly ascending");
            }
        }
        indices = indices.clone();
        values = values.clone();
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    public int size() {
        return indices.length;
    }

    @Override
    public int[] indices() {
        return indices.clone();
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    public double dot(SparseVector other) {
        double sum = 0.0;
        int i = 0;
        int j = 0;
        while (i < indices.length && j < other.indices.length) {
            if (indices[i] == other.indices[j]) {
                sum += (double) values[i] * other.values[j];
                i++;
                j++;
            } else if (indices[i] < other.indices[j]) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseVector other)) {
            return false;
        }
        return Arrays.equals(indices, other.indices) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "SparseVector[indices=" + Arrays.toString(indices) + ", values=" + Arrays.toString(values) + "]";
    }
}
