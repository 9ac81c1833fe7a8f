package io.mnemo.cli;

import io.mnemo.core.collection.MemoryCategory;
import io.mnemo.core.config.model.MnemoConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and record counts")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Vector backend: " + config.vector().backend());
            if (!config.vector().inMemory()) {
                System.out.println("Qdrant URL: " + config.vector().url());
            }
            System.out.println("Collection prefix: " + config.vector().collectionPrefix());
            System.out.println("Embedding provider: " + config.embedding().provider());
            System.out.println("Retrieval mode: " + config.retrieval().mode());
            System.out.println("Cache: " + config.cache().type() + " (ttl " + config.cache().ttlSeconds() + "s)");
            for (MemoryCategory category : MemoryCategory.values()) {
                System.out.println("Records in " + category.key() + ": " + countOrError(category));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private String countOrError(MemoryCategory category) {
        try {
            return String.valueOf(context.stores().forCategory(category).count());
        } catch (Exception e) {
            return "unavailable (" + e.getMessage() + ")";
        }
    }
}
