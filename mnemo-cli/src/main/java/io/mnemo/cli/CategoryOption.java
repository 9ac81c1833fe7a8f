package io.mnemo.cli;

import io.mnemo.core.collection.MemoryCategory;
import picocli.CommandLine.Option;

final class CategoryOption {

    @Option(
        names = {"-c", "--category"},
        description = "Memory category: memories, sessions or knowledge",
        defaultValue = "memories"
    )
    String category;

    MemoryCategory resolve() {
        return MemoryCategory.fromKey(category);
    }
}
