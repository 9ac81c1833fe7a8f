package io.mnemo.core.vector;

import java.util.Locale;

public enum Distance {
    COSINE("Cosine", true),
    DOT("Dot", true),
    EUCLID("Euclid", false),
    MANHATTAN("Manhattan", false);

    private final String wireName;
    private final boolean higherIsCloser;

    Distance(String wireName, boolean higherIsCloser) {
        this.wireName = wireName;
        this.higherIsCloser = higherIsCloser;
    }

    public String wireName() {
        return wireName;
    }

    public boolean higherIsCloser() {
        return higherIsCloser;
    }

    public static Distance parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return COSINE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Distance distance : values()) {
            if (distance.name().toLowerCase(Locale.ROOT).equals(normalized)
                || distance.wireName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return distance;
            }
        }
        throw new IllegalArgumentException("Unknown distance metric: " + raw);
    }
}
