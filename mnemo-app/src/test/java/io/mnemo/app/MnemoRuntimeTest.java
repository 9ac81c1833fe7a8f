package io.mnemo.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.cli.CliContext;
import io.mnemo.core.cache.EphemeralCache;
import io.mnemo.core.cache.InMemoryEphemeralCache;
import io.mnemo.core.collection.MemoryCategory;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.EmbeddingConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.VectorConfig;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.vector.InMemoryVectorBackend;
import io.mnemo.core.vector.QdrantRestBackend;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MnemoRuntimeTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWireInMemoryRuntimeFromConfig() throws Exception {
        MnemoConfig config = MnemoConfig.defaults().withVector(inMemoryVector());

        MnemoRuntime runtime = MnemoRuntime.create(config, MnemoRuntime.httpClient(5), Clock.systemUTC());
        runtime.stores().forCategory(MemoryCategory.MEMORIES).upsert(MemoryRecord.forUser("u1", "likes tea", List.of()));

        assertThat(runtime.backend()).isInstanceOf(InMemoryVectorBackend.class);
        assertThat(runtime.cache()).isInstanceOf(InMemoryEphemeralCache.class);
        assertThat(runtime.embeddings().modelId()).isEqualTo("hashing/384");
        assertThat(runtime.stores().forCategory(MemoryCategory.MEMORIES).count()).isEqualTo(1);
        assertThat(runtime.backend().collectionExists("mnemo_memories")).isTrue();
    }

    @Test
    void shouldUseQdrantBackendByDefault() {
        MnemoRuntime runtime = MnemoRuntime.create(MnemoConfig.defaults(), MnemoRuntime.httpClient(5), Clock.systemUTC());

        assertThat(runtime.backend()).isInstanceOf(QdrantRestBackend.class);
    }

    @Test
    void shouldRequireApiKeyForOpenAiEmbeddings() {
        MnemoConfig defaults = MnemoConfig.defaults();
        MnemoConfig config = new MnemoConfig(
            inMemoryVector(),
            new EmbeddingConfig("openai", "text-embedding-3-small", "", "https://api.openai.com/v1", 1536),
            defaults.retrieval(),
            defaults.cache(),
            defaults.gateway()
        );

        assertThatThrownBy(() -> MnemoRuntime.create(config, MnemoRuntime.httpClient(5), Clock.systemUTC()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldCloseCacheWithRuntime() {
        MnemoRuntime created = MnemoRuntime.create(
            MnemoConfig.defaults().withVector(inMemoryVector()),
            MnemoRuntime.httpClient(5),
            Clock.systemUTC()
        );
        AtomicBoolean closed = new AtomicBoolean();
        EphemeralCache cache = new EphemeralCache() {
            @Override
            public void put(String key, String value) {
            }

            @Override
            public Optional<String> get(String key) {
                return Optional.empty();
            }

            @Override
            public Duration ttl() {
                return DEFAULT_TTL;
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };

        try (MnemoRuntime runtime = new MnemoRuntime(created.stores(), cache, created.backend(), created.embeddings())) {
            assertThat(runtime.cache()).isSameAs(cache);
        }

        assertThat(closed).isTrue();
    }

    @Test
    void shouldRegisterAllSubcommands() {
        MnemoRuntime runtime = MnemoRuntime.create(
            MnemoConfig.defaults().withVector(inMemoryVector()),
            MnemoRuntime.httpClient(5),
            Clock.systemUTC()
        );
        CliContext context = new CliContext(runtime.stores(), runtime.cache(), new ConfigService(), tempDir.resolve("config.json"));

        CommandLine commandLine = MnemoApplication.commandLine(context);

        assertThat(commandLine.getSubcommands().keySet())
            .containsExactlyInAnyOrder("remember", "get", "list", "recall", "forget", "clear", "status", "serve", "init");
    }

    private static VectorConfig inMemoryVector() {
        VectorConfig defaults = VectorConfig.defaults();
        return new VectorConfig(
            "memory",
            defaults.url(),
            defaults.apiKey(),
            defaults.collectionPrefix(),
            defaults.distance(),
            defaults.sparseEnabled(),
            defaults.timeoutSeconds()
        );
    }
}
