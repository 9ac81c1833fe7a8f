package io.mnemo.app;

import io.mnemo.core.cache.EphemeralCache;
import io.mnemo.core.cache.InMemoryEphemeralCache;
import io.mnemo.core.cache.RedisEphemeralCache;
import io.mnemo.core.collection.CollectionRegistry;
import io.mnemo.core.config.model.CacheConfig;
import io.mnemo.core.config.model.EmbeddingConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.RetrievalConfig;
import io.mnemo.core.config.model.VectorConfig;
import io.mnemo.core.embedding.EmbeddingProvider;
import io.mnemo.core.embedding.HashingEmbeddingProvider;
import io.mnemo.core.embedding.OpenAiEmbeddingProvider;
import io.mnemo.core.memory.MemoryStores;
import io.mnemo.core.memory.SortScope;
import io.mnemo.core.retrieval.HybridRetrievalEngine;
import io.mnemo.core.retrieval.ReciprocalRankFusion;
import io.mnemo.core.retrieval.RetrievalMode;
import io.mnemo.core.vector.CollectionSchema;
import io.mnemo.core.vector.Distance;
import io.mnemo.core.vector.InMemoryVectorBackend;
import io.mnemo.core.vector.QdrantRestBackend;
import io.mnemo.core.vector.VectorBackend;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record MnemoRuntime(MemoryStores stores, EphemeralCache cache, VectorBackend backend, EmbeddingProvider embeddings)
    implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MnemoRuntime.class);

    public static MnemoRuntime create(MnemoConfig config) {
        OkHttpClient http = httpClient(config.vector().timeoutSeconds());
        return create(config, http, Clock.systemUTC());
    }

    static MnemoRuntime create(MnemoConfig config, OkHttpClient http, Clock clock) {
        EmbeddingProvider embeddings = buildEmbeddings(config.embedding(), http);
        VectorBackend backend = buildBackend(config.vector(), http);
        CollectionSchema schema = new CollectionSchema(
            embeddings.dimensions(),
            Distance.parse(config.vector().distance()),
            config.vector().sparseEnabled()
        );
        CollectionRegistry registry = new CollectionRegistry(backend, config.vector().collectionPrefix(), schema);

        RetrievalConfig retrieval = config.retrieval();
        HybridRetrievalEngine engine = new HybridRetrievalEngine(
            backend,
            embeddings,
            RetrievalMode.parse(retrieval.mode()),
            new ReciprocalRankFusion(retrieval.rrfK()),
            retrieval.candidateDepth()
        );
        MemoryStores stores = MemoryStores.hybrid(
            backend,
            registry,
            engine,
            embeddings,
            clock,
            SortScope.parse(retrieval.sortScope())
        );
        LOG.info(
            "Memory runtime ready: backend={}, embeddings={}, mode={}",
            config.vector().backend(),
            embeddings.modelId(),
            engine.mode()
        );
        return new MnemoRuntime(stores, buildCache(config.cache(), clock), backend, embeddings);
    }

    @Override
    public void close() {
        cache.close();
    }

    static OkHttpClient httpClient(int timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds <= 0 ? 30 : timeoutSeconds);
        return new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .callTimeout(timeout.multipliedBy(2))
            .build();
    }

    private static EmbeddingProvider buildEmbeddings(EmbeddingConfig config, OkHttpClient http) {
        String provider = config.provider() == null ? "hashing" : config.provider().trim().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "hashing" -> new HashingEmbeddingProvider(config.dimensions());
            case "openai" -> {
                if (!config.configured()) {
                    throw new IllegalStateException("embedding.apiKey is required for the openai provider");
                }
                yield new OpenAiEmbeddingProvider(http, config.apiKey(), config.apiBase(), config.model(), config.dimensions());
            }
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + config.provider());
        };
    }

    private static VectorBackend buildBackend(VectorConfig config, OkHttpClient http) {
        if (config.inMemory()) {
            return new InMemoryVectorBackend();
        }
        return new QdrantRestBackend(http, config.url(), config.apiKey());
    }

    private static EphemeralCache buildCache(CacheConfig config, Clock clock) {
        Duration ttl = Duration.ofSeconds(config.ttlSeconds());
        if (config.redis()) {
            return RedisEphemeralCache.connect(config.host(), config.port(), config.password(), ttl, config.keyPrefix());
        }
        return new InMemoryEphemeralCache(ttl, clock);
    }
}
