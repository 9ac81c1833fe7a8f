package io.mnemo.cli;

import io.mnemo.core.cache.EphemeralCache;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.memory.MemoryStores;
import java.nio.file.Path;

public record CliContext(
    MemoryStores stores,
    EphemeralCache cache,
    ConfigService configService,
    Path configPath,
    GatewayRunner gatewayRunner
) {
    public CliContext(MemoryStores stores, EphemeralCache cache, ConfigService configService, Path configPath) {
        this(stores, cache, configService, configPath, (host, port) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
