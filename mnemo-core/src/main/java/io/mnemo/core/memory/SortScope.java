package io.mnemo.core.memory;

import java.util.Locale;

public enum SortScope {
    GLOBAL,
    PAGE;

    public static SortScope parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return GLOBAL;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sort scope: " + raw, e);
        }
    }
}
