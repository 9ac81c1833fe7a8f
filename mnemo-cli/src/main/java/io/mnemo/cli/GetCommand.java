package io.mnemo.cli;

import io.mnemo.core.memory.MemoryRecord;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "get", description = "Show one memory by id")
public final class GetCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    CategoryOption category = new CategoryOption();

    @Parameters(index = "0", arity = "1", description = "Memory id")
    String memoryId;

    public GetCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Optional<MemoryRecord> record = context.stores().forCategory(category.resolve()).get(memoryId);
            if (record.isEmpty()) {
                System.err.println("Memory not found: " + memoryId);
                return 2;
            }
            System.out.println(RecordFormatter.detail(record.get()));
            return 0;
        } catch (Exception e) {
            System.err.println("Get command failed: " + e.getMessage());
            return 1;
        }
    }
}
