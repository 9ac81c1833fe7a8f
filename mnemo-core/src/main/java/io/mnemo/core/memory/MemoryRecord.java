package io.mnemo.core.memory;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryRecord(
    @JsonProperty("memory_id") @JsonAlias({"memoryId", "id"}) String memoryId,
    @JsonProperty("user_id") @JsonAlias({"userId"}) String userId,
    @JsonProperty("agent_id") @JsonAlias({"agentId"}) String agentId,
    @JsonProperty("team_id") @JsonAlias({"teamId"}) String teamId,
    @JsonProperty("memory") @JsonAlias({"content"}) String content,
    @JsonProperty("topics") List<String> topics,
    @JsonProperty("input") String input,
    @JsonProperty("updated_at") @JsonAlias({"updatedAt"}) Instant updatedAt
) {

    public MemoryRecord {
        content = content == null ? "" : content;
        topics = copyTopics(topics);
    }

    public static MemoryRecord of(String content) {
        return new MemoryRecord(null, null, null, null, content, List.of(), null, null);
    }

    public static MemoryRecord forUser(String userId, String content, List<String> topics) {
        return new MemoryRecord(null, userId, null, null, content, topics, null, null);
    }

    public MemoryRecord withMemoryId(String id) {
        return new MemoryRecord(id, userId, agentId, teamId, content, topics, input, updatedAt);
    }

    public MemoryRecord withUpdatedAt(Instant timestamp) {
        return new MemoryRecord(memoryId, userId, agentId, teamId, content, topics, input, timestamp);
    }

    public boolean hasMemoryId() {
        return memoryId != null && !memoryId.isBlank();
    }

    private static List<String> copyTopics(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>(raw.size());
        for (String topic : raw) {
            if (topic != null) {
                out.add(topic);
            }
        }
        return List.copyOf(out);
    }
}
