package io.mnemo.cli;

import io.mnemo.core.memory.ScoredMemory;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "recall", description = "Find the memories most similar to a query")
public final class RecallCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    CategoryOption category = new CategoryOption();

    @Parameters(index = "0", arity = "1", description = "Query text")
    String query;

    @Option(names = {"-n", "--limit"}, description = "Maximum results", defaultValue = "5")
    int limit;

    public RecallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<ScoredMemory> results = context.stores().forCategory(category.resolve()).recall(query, limit);
            if (results.isEmpty()) {
                System.out.println("No matching memories.");
                return 0;
            }
            for (ScoredMemory result : results) {
                System.out.println(String.format(Locale.ROOT, "%.4f\t%s", result.score(), RecordFormatter.line(result.record())));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Recall command failed: " + e.getMessage());
            return 1;
        }
    }
}
