package io.mnemo.cli;

import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "forget", description = "Delete memories by id")
public final class ForgetCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    CategoryOption category = new CategoryOption();

    @Parameters(arity = "1..*", description = "Memory ids")
    List<String> memoryIds;

    public ForgetCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            context.stores().forCategory(category.resolve()).deleteMany(memoryIds);
            System.out.println("Deleted " + memoryIds.size() + " memory id(s).");
            return 0;
        } catch (Exception e) {
            System.err.println("Forget command failed: " + e.getMessage());
            return 1;
        }
    }
}
