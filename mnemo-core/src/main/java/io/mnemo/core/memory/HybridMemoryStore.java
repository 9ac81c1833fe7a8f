package io.mnemo.core.memory;

import io.mnemo.core.collection.CollectionHandle;
import io.mnemo.core.collection.CollectionRegistry;
import io.mnemo.core.collection.MemoryCategory;
import io.mnemo.core.embedding.EmbeddingProvider;
import io.mnemo.core.embedding.SparseVector;
import io.mnemo.core.filter.Filter;
import io.mnemo.core.filter.FilterBuilder;
import io.mnemo.core.retrieval.HybridRetrievalEngine;
import io.mnemo.core.retrieval.SearchRequest;
import io.mnemo.core.retrieval.SearchResult;
import io.mnemo.core.vector.PointIds;
import io.mnemo.core.vector.ScoredPoint;
import io.mnemo.core.vector.VectorBackend;
import io.mnemo.core.vector.VectorPoint;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HybridMemoryStore implements MemoryStore {
    private static final Logger LOG = LoggerFactory.getLogger(HybridMemoryStore.class);

    private final MemoryCategory category;
    private final VectorBackend backend;
    private final CollectionRegistry registry;
    private final HybridRetrievalEngine engine;
    private final EmbeddingProvider embeddings;
    private final Clock clock;
    private final SortScope sortScope;

    public HybridMemoryStore(
        MemoryCategory category,
        VectorBackend backend,
        CollectionRegistry registry,
        HybridRetrievalEngine engine,
        EmbeddingProvider embeddings
    ) {
        this(category, backend, registry, engine, embeddings, Clock.systemUTC(), SortScope.GLOBAL);
    }

    public HybridMemoryStore(
        MemoryCategory category,
        VectorBackend backend,
        CollectionRegistry registry,
        HybridRetrievalEngine engine,
        EmbeddingProvider embeddings,
        Clock clock,
        SortScope sortScope
    ) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sortScope = Objects.requireNonNull(sortScope, "sortScope must not be null");
    }

    public MemoryCategory category() {
        return category;
    }

    @Override
    public MemoryRecord upsert(MemoryRecord record) throws IOException {
        Objects.requireNonNull(record, "record must not be null");
        String memoryId = record.hasMemoryId() ? record.memoryId() : UUID.randomUUID().toString();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        MemoryRecord stored = record.withMemoryId(memoryId).withUpdatedAt(now);

        try {
            float[] dense = embeddings.embedDense(stored.content());
            SparseVector sparse = embeddings.embedSparse(stored.content());
            CollectionHandle handle = registry.ensure(category);
            VectorPoint point = new VectorPoint(
                PointIds.of(memoryId),
                dense,
                handle.schema().sparseEnabled() ? sparse : SparseVector.empty(),
                MemoryPayloads.toPayload(stored)
            );
            backend.upsert(handle.name(), List.of(point));
        } catch (IOException e) {
            throw failure("upsert", e);
        }
        LOG.debug("Upserted memory {} into {}", memoryId, category.key());
        return stored;
    }

    @Override
    public Optional<MemoryRecord> get(String memoryId) throws IOException {
        if (memoryId == null || memoryId.isBlank()) {
            return Optional.empty();
        }
        try {
            if (!registry.exists(category)) {
                return Optional.empty();
            }
            List<ScoredPoint> found = backend.retrieve(registry.name(category), List.of(PointIds.of(memoryId)));
            return found.stream().findFirst().map(point -> MemoryPayloads.fromPayload(point.payload()));
        } catch (IOException e) {
            throw failure("get", e);
        }
    }

    @Override
    public MemoryPage list(MemoryQuery query) throws IOException {
        Objects.requireNonNull(query, "query must not be null");
        Filter filter = FilterBuilder.build(query.userId(), query.agentId(), query.teamId(), query.topics());
        CollectionHandle handle = registry.handle(category);
        int offset = query.offset();

        try {
            if (query.sortBy() == null || sortScope == SortScope.PAGE) {
                SearchResult result = engine.search(
                    handle,
                    new SearchRequest(query.queryText(), filter, query.limit(), offset)
                );
                List<MemoryRecord> records = toRecords(result.hits());
                if (query.sortBy() != null) {
                    records.sort(query.sortBy().comparator(query.sortOrder()));
                }
                return new MemoryPage(records, result.totalCount());
            }

            int depth = query.limit() == null ? 0 : offset + query.limit();
            SearchResult result = engine.search(handle, new SearchRequest(query.queryText(), filter, null, 0, depth));
            List<MemoryRecord> records = toRecords(result.hits());
            records.sort(query.sortBy().comparator(query.sortOrder()));
            int from = Math.min(offset, records.size());
            int to = query.limit() == null ? records.size() : Math.min(records.size(), from + query.limit());
            return new MemoryPage(records.subList(from, to), result.totalCount());
        } catch (IOException e) {
            throw failure("list", e);
        }
    }

    @Override
    public List<ScoredMemory> recall(String queryText, int limit) throws IOException {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("queryText must not be blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        try {
            SearchResult result = engine.search(
                registry.handle(category),
                new SearchRequest(queryText, Filter.empty(), limit, 0)
            );
            List<ScoredMemory> scored = new ArrayList<>(result.hits().size());
            for (ScoredPoint hit : result.hits()) {
                scored.add(new ScoredMemory(MemoryPayloads.fromPayload(hit.payload()), hit.score()));
            }
            return scored;
        } catch (IOException e) {
            throw failure("recall", e);
        }
    }

    @Override
    public void delete(String memoryId) throws IOException {
        deleteMany(memoryId == null ? List.of() : List.of(memoryId));
    }

    @Override
    public void deleteMany(Collection<String> memoryIds) throws IOException {
        Objects.requireNonNull(memoryIds, "memoryIds must not be null");
        LinkedHashSet<String> pointIds = new LinkedHashSet<>();
        for (String memoryId : memoryIds) {
            if (memoryId != null && !memoryId.isBlank()) {
                pointIds.add(PointIds.of(memoryId));
            }
        }
        if (pointIds.isEmpty()) {
            return;
        }
        try {
            if (!registry.exists(category)) {
                return;
            }
            backend.delete(registry.name(category), List.copyOf(pointIds));
        } catch (IOException e) {
            throw failure("delete", e);
        }
        LOG.debug("Deleted {} memories from {}", pointIds.size(), category.key());
    }

    @Override
    public void clear() throws IOException {
        try {
            if (!registry.exists(category)) {
                return;
            }
            backend.deleteMatching(registry.name(category), Filter.empty());
        } catch (IOException e) {
            throw failure("clear", e);
        }
        LOG.info("Cleared all memories in {}", category.key());
    }

    @Override
    public long count() throws IOException {
        try {
            if (!registry.exists(category)) {
                return 0;
            }
            return backend.count(registry.name(category), Filter.empty());
        } catch (IOException e) {
            throw failure("count", e);
        }
    }

    private List<MemoryRecord> toRecords(List<ScoredPoint> hits) {
        List<MemoryRecord> records = new ArrayList<>(hits.size());
        for (ScoredPoint hit : hits) {
            records.add(MemoryPayloads.fromPayload(hit.payload()));
        }
        return records;
    }

    private MemoryStoreException failure(String operation, IOException cause) {
        LOG.warn("Memory {} failed for category {}", operation, category.key(), cause);
        return new MemoryStoreException(category, operation, cause);
    }
}
