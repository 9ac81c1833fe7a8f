package io.mnemo.cli;

import io.mnemo.core.memory.MemoryRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "remember", description = "Store or update a memory")
public final class RememberCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    CategoryOption category = new CategoryOption();

    @Parameters(index = "0", arity = "1", description = "Memory text")
    String content;

    @Option(names = {"--id"}, description = "Memory id to create or replace")
    String memoryId;

    @Option(names = {"-u", "--user"}, description = "Owning user id")
    String userId;

    @Option(names = {"-a", "--agent"}, description = "Owning agent id")
    String agentId;

    @Option(names = {"-t", "--team"}, description = "Owning team id")
    String teamId;

    @Option(names = {"--topic"}, description = "Topic tag, repeatable")
    List<String> topics = new ArrayList<>();

    @Option(names = {"--input"}, description = "Source input the memory was derived from")
    String input;

    public RememberCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryRecord record = new MemoryRecord(memoryId, userId, agentId, teamId, content, topics, input, null);
            MemoryRecord stored = context.stores().forCategory(category.resolve()).upsert(record);
            System.out.println(stored.memoryId());
            return 0;
        } catch (Exception e) {
            System.err.println("Remember command failed: " + e.getMessage());
            return 1;
        }
    }
}
