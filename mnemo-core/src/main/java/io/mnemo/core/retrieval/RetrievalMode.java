package io.mnemo.core.retrieval;

import java.util.Locale;

public enum RetrievalMode {
    HYBRID,
    DENSE,
    SPARSE;

    public static RetrievalMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return HYBRID;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown retrieval mode: " + raw, e);
        }
    }
}
