package io.mnemo.core.memory;

import java.util.List;

public record MemoryPage(List<MemoryRecord> records, long totalCount) {

    public MemoryPage {
        records = List.copyOf(records);
    }
}
