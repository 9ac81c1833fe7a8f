package io.mnemo.core.memory;

public record ScoredMemory(MemoryRecord record, double score) {
}
