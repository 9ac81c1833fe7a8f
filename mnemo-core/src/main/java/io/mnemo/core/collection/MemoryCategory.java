package io.mnemo.core.collection;

import java.util.Locale;

public enum MemoryCategory {
    MEMORIES("memories"),
    SESSIONS("sessions"),
    KNOWLEDGE("knowledge");

    private final String key;

    MemoryCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static MemoryCategory fromKey(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (MemoryCategory category : values()) {
                if (category.key.equals(normalized)) {
                    return category;
                }
            }
        }
        throw new IllegalArgumentException("Unknown memory category: " + raw);
    }
}
