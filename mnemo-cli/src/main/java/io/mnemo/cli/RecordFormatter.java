package io.mnemo.cli;

import io.mnemo.core.memory.MemoryRecord;

final class RecordFormatter {

    private RecordFormatter() {
    }

    static String line(MemoryRecord record) {
        StringBuilder out = new StringBuilder();
        out.append(record.memoryId()).append('\t');
        out.append(record.updatedAt() == null ? "-" : record.updatedAt().toString()).append('\t');
        out.append(record.content());
        if (!record.topics().isEmpty()) {
            out.append(" [").append(String.join(", ", record.topics())).append(']');
        }
        return out.toString();
    }

    static String detail(MemoryRecord record) {
        StringBuilder out = new StringBuilder();
        out.append("memory_id: ").append(record.memoryId()).append(System.lineSeparator());
        appendIfPresent(out, "user_id", record.userId());
        appendIfPresent(out, "agent_id", record.agentId());
        appendIfPresent(out, "team_id", record.teamId());
        if (!record.topics().isEmpty()) {
            out.append("topics: ").append(String.join(", ", record.topics())).append(System.lineSeparator());
        }
        appendIfPresent(out, "input", record.input());
        if (record.updatedAt() != null) {
            out.append("updated_at: ").append(record.updatedAt()).append(System.lineSeparator());
        }
        out.append("memory: ").append(record.content());
        return out.toString();
    }

    private static void appendIfPresent(StringBuilder out, String label, String value) {
        if (value != null && !value.isBlank()) {
            out.append(label).append(": ").append(value).append(System.lineSeparator());
        }
    }
}
