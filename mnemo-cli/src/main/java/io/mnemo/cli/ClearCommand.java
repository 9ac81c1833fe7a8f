package io.mnemo.cli;

import io.mnemo.core.collection.MemoryCategory;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "clear", description = "Delete every memory in a category")
public final class ClearCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    CategoryOption category = new CategoryOption();

    @Option(names = {"--yes"}, description = "Confirm deletion")
    boolean confirmed;

    public ClearCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryCategory target = category.resolve();
            if (!confirmed) {
                System.err.println("Refusing to clear " + target.key() + " without --yes");
                return 2;
            }
            context.stores().forCategory(target).clear();
            System.out.println("Cleared " + target.key() + ".");
            return 0;
        } catch (Exception e) {
            System.err.println("Clear command failed: " + e.getMessage());
            return 1;
        }
    }
}
