package io.mnemo.core.memory;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder parse(String raw) {
        return raw != null && "desc".equalsIgnoreCase(raw.trim()) ? DESC : ASC;
    }
}
