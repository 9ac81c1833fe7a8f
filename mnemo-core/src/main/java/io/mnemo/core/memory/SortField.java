package io.mnemo.core.memory;

import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;

public enum SortField {
    MEMORY_ID("memory_id"),
    USER_ID("user_id"),
    AGENT_ID("agent_id"),
    TEAM_ID("team_id"),
    CONTENT("memory"),
    UPDATED_AT("updated_at");

    private final String fieldName;

    SortField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }

    public static SortField parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("sort field must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("content".equals(normalized)) {
            return CONTENT;
        }
        for (SortField field : values()) {
            if (field.fieldName.equals(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Cannot sort memories by unknown field: " + raw);
    }

    // Missing values sort last in both directions.
    public Comparator<MemoryRecord> comparator(SortOrder order) {
        return switch (this) {
            case MEMORY_ID -> text(MemoryRecord::memoryId, order);
            case USER_ID -> text(MemoryRecord::userId, order);
            case AGENT_ID -> text(MemoryRecord::agentId, order);
            case TEAM_ID -> text(MemoryRecord::teamId, order);
            case CONTENT -> text(MemoryRecord::content, order);
            case UPDATED_AT -> Comparator.comparing(
                MemoryRecord::updatedAt,
                Comparator.nullsLast(order == SortOrder.DESC
                    ? Comparator.<Instant>reverseOrder()
                    : Comparator.<Instant>naturalOrder())
            );
        };
    }

    private static Comparator<MemoryRecord> text(Function<MemoryRecord, String> extractor, SortOrder order) {
        return Comparator.comparing(
            extractor,
            Comparator.nullsLast(order == SortOrder.DESC
                ? Comparator.<String>reverseOrder()
                : Comparator.<String>naturalOrder())
        );
    }
}
