package io.mnemo.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.cache.InMemoryEphemeralCache;
import io.mnemo.core.collection.CollectionRegistry;
import io.mnemo.core.collection.MemoryCategory;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.embedding.HashingEmbeddingProvider;
import io.mnemo.core.memory.MemoryQuery;
import io.mnemo.core.memory.MemoryStores;
import io.mnemo.core.memory.SortScope;
import io.mnemo.core.retrieval.HybridRetrievalEngine;
import io.mnemo.core.vector.CollectionSchema;
import io.mnemo.core.vector.Distance;
import io.mnemo.core.vector.InMemoryVectorBackend;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MemoryCommandsIntegrationTest {

    @TempDir
    Path tempDir;

    private MemoryStores stores;
    private CliContext context;

    @BeforeEach
    void setUp() {
        InMemoryVectorBackend backend = new InMemoryVectorBackend();
        HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider(128);
        CollectionRegistry registry = new CollectionRegistry(backend, "cli", new CollectionSchema(128, Distance.COSINE, true));
        stores = MemoryStores.hybrid(
            backend,
            registry,
            new HybridRetrievalEngine(backend, embeddings),
            embeddings,
            Clock.systemUTC(),
            SortScope.GLOBAL
        );
        context = new CliContext(stores, new InMemoryEphemeralCache(), new ConfigService(), tempDir.resolve("config.json"));
    }

    @Test
    void shouldRememberAndListMemories() throws Exception {
        Result remembered = run(new RememberCommand(context),
            "walks every day", "--id", "A", "--user", "u1", "--topic", "health");
        run(new RememberCommand(context), "saves ten percent", "--id", "B", "--user", "u1", "--topic", "finance");

        assertThat(remembered.code()).isZero();
        assertThat(remembered.out().trim()).isEqualTo("A");

        Result listed = run(new ListCommand(context), "--user", "u1", "--topic", "health");
        assertThat(listed.code()).isZero();
        assertThat(listed.out()).contains("walks every day [health]").doesNotContain("saves ten percent");
        assertThat(listed.out()).contains("Total: 1");
    }

    @Test
    void shouldGetRecallAndForgetInCategory() throws Exception {
        run(new RememberCommand(context), "green tea every morning", "--id", "tea", "-c", "knowledge");
        run(new RememberCommand(context), "drives an electric car", "--id", "car", "-c", "knowledge");

        Result got = run(new GetCommand(context), "tea", "--category", "knowledge");
        assertThat(got.out()).contains("memory: green tea every morning");

        Result recalled = run(new RecallCommand(context), "green tea", "-n", "1", "-c", "knowledge");
        assertThat(recalled.out()).contains("tea\t").doesNotContain("electric car");

        Result forgot = run(new ForgetCommand(context), "tea", "car", "-c", "knowledge");
        assertThat(forgot.code()).isZero();
        assertThat(stores.forCategory(MemoryCategory.KNOWLEDGE).list(MemoryQuery.all()).totalCount()).isZero();
        assertThat(run(new GetCommand(context), "tea", "-c", "knowledge").code()).isEqualTo(2);
    }

    @Test
    void shouldRequireConfirmationToClear() throws Exception {
        run(new RememberCommand(context), "session note", "-c", "sessions");

        assertThat(run(new ClearCommand(context), "-c", "sessions").code()).isEqualTo(2);
        assertThat(stores.forCategory(MemoryCategory.SESSIONS).count()).isEqualTo(1);

        assertThat(run(new ClearCommand(context), "-c", "sessions", "--yes").code()).isZero();
        assertThat(stores.forCategory(MemoryCategory.SESSIONS).count()).isZero();
    }

    @Test
    void shouldFailOnUnknownCategoryOrSortField() throws Exception {
        assertThat(run(new ListCommand(context), "-c", "diary").code()).isEqualTo(1);
        assertThat(run(new ListCommand(context), "--sort-by", "mood").code()).isEqualTo(1);
    }

    @Test
    void shouldPrintStatus() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), "{\"vector\": {\"backend\": \"memory\"}}");
        run(new RememberCommand(context), "one note");

        Result status = run(new StatusCommand(context));

        assertThat(status.code()).isZero();
        assertThat(status.out()).contains("Vector backend: memory").contains("Records in memories: 1");
    }

    @Test
    void shouldInitConfigAndKeepExistingValues() throws Exception {
        Result created = run(new InitCommand(context));
        assertThat(created.code()).isZero();
        assertThat(created.out()).contains("Created config: " + context.configPath());
        assertThat(context.configService().load(context.configPath()).vector().collectionPrefix())
            .isEqualTo(MnemoConfig.defaults().vector().collectionPrefix());

        Files.writeString(context.configPath(), "{\"vector\": {\"collection_prefix\": \"team\"}}");
        Result refreshed = run(new InitCommand(context));
        assertThat(refreshed.out()).contains("Refreshed config with new defaults");
        assertThat(context.configService().load(context.configPath()).vector().collectionPrefix()).isEqualTo("team");

        Result overwritten = run(new InitCommand(context), "--overwrite");
        assertThat(overwritten.out()).contains("Overwrote config with defaults");
        assertThat(context.configService().load(context.configPath()).vector().collectionPrefix())
            .isEqualTo(MnemoConfig.defaults().vector().collectionPrefix());
    }

    @Test
    void shouldDelegateServeToGatewayRunner() throws Exception {
        AtomicReference<String> bound = new AtomicReference<>();
        CliContext serving = new CliContext(
            stores,
            context.cache(),
            context.configService(),
            context.configPath(),
            (host, port) -> {
                bound.set(host + ":" + port);
                return 0;
            }
        );

        assertThat(run(new ServeCommand(serving), "--port", "9000").code()).isZero();
        assertThat(bound.get()).isEqualTo("null:9000");
    }

    private static Result run(Callable<Integer> command, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            code = new CommandLine(command).execute(args);
        } finally {
            System.setOut(originalOut);
        }
        return new Result(code, out.toString(StandardCharsets.UTF_8));
    }

    private record Result(int code, String out) {
    }
}
