package io.mnemo.core.memory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class MemoryPayloads {
    static final String MEMORY_ID = "memory_id";
    static final String USER_ID = "user_id";
    static final String AGENT_ID = "agent_id";
    static final String TEAM_ID = "team_id";
    static final String MEMORY = "memory";
    static final String TOPICS = "topics";
    static final String INPUT = "input";
    static final String UPDATED_AT = "updated_at";

    private MemoryPayloads() {
    }

    static Map<String, Object> toPayload(MemoryRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(MEMORY_ID, record.memoryId());
        putIfPresent(payload, USER_ID, record.userId());
        putIfPresent(payload, AGENT_ID, record.agentId());
        putIfPresent(payload, TEAM_ID, record.teamId());
        payload.put(MEMORY, record.content());
        payload.put(TOPICS, record.topics());
        putIfPresent(payload, INPUT, record.input());
        if (record.updatedAt() != null) {
            payload.put(UPDATED_AT, record.updatedAt().toEpochMilli());
        }
        return payload;
    }

    static MemoryRecord fromPayload(Map<String, Object> payload) {
        return new MemoryRecord(
            text(payload.get(MEMORY_ID)),
            text(payload.get(USER_ID)),
            text(payload.get(AGENT_ID)),
            text(payload.get(TEAM_ID)),
            text(payload.get(MEMORY)),
            topics(payload.get(TOPICS)),
            text(payload.get(INPUT)),
            instant(payload.get(UPDATED_AT))
        );
    }

    private static void putIfPresent(Map<String, Object> payload, String key, String value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static List<String> topics(Object value) {
        if (!(value instanceof Collection<?> raw)) {
            return List.of();
        }
        List<String> topics = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (item != null) {
                topics.add(String.valueOf(item));
            }
        }
        return topics;
    }

    private static Instant instant(Object value) {
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(text.trim()));
            } catch (NumberFormatException notEpoch) {
                try {
                    return Instant.parse(text.trim());
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Unreadable updated_at in payload: " + text, e);
                }
            }
        }
        return null;
    }
}
