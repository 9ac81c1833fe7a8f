package io.mnemo.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.collection.CollectionHandle;
import io.mnemo.core.collection.CollectionRegistry;
import io.mnemo.core.collection.MemoryCategory;
import io.mnemo.core.embedding.HashingEmbeddingProvider;
import io.mnemo.core.filter.Filter;
import io.mnemo.core.filter.FilterBuilder;
import io.mnemo.core.vector.CollectionSchema;
import io.mnemo.core.vector.Distance;
import io.mnemo.core.vector.InMemoryVectorBackend;
import io.mnemo.core.vector.ScoredPoint;
import io.mnemo.core.vector.VectorPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HybridRetrievalEngineTest {

    private final HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider(256);
    private InMemoryVectorBackend backend;
    private CollectionRegistry registry;
    private HybridRetrievalEngine engine;

    @BeforeEach
    void setUp() {
        backend = new InMemoryVectorBackend();
        registry = new CollectionRegistry(backend, "test", new CollectionSchema(256, Distance.COSINE, true));
        engine = new HybridRetrievalEngine(backend, embeddings);
    }

    @Test
    void shouldReturnEmptyResultForUnprovisionedCollection() throws Exception {
        SearchResult result = engine.search(registry.handle(MemoryCategory.MEMORIES), new SearchRequest("tea", Filter.empty(), 5, 0));

        assertThat(result.hits()).isEmpty();
        assertThat(result.totalCount()).isZero();
    }

    @Test
    void shouldPaginateScansExactly() throws Exception {
        CollectionHandle handle = registry.ensure(MemoryCategory.MEMORIES);
        insert(handle, "one", "two", "three", "four", "five");

        SearchResult page = engine.search(handle, new SearchRequest(null, Filter.empty(), 2, 2));
        SearchResult all = engine.search(handle, new SearchRequest("  ", Filter.empty(), null, 0));
        SearchResult beyond = engine.search(handle, new SearchRequest(null, Filter.empty(), 2, 10));

        assertThat(page.hits()).extracting(hit -> hit.payload().get("memory")).containsExactly("three", "four");
        assertThat(page.totalCount()).isEqualTo(5);
        assertThat(all.hits()).hasSize(5);
        assertThat(beyond.hits()).isEmpty();
        assertThat(beyond.totalCount()).isEqualTo(5);
    }

    @Test
    void shouldCountOnlyFilteredRecords() throws Exception {
        CollectionHandle handle = registry.ensure(MemoryCategory.MEMORIES);
        backend.upsert(handle.name(), List.of(
            point("a", "green tea", "u1"),
            point("b", "green tea", "u2"),
            point("c", "black coffee", "u1")
        ));

        SearchResult result = engine.search(handle, new SearchRequest(null, FilterBuilder.build("u1", null, null, null), 10, 0));

        assertThat(result.hits()).extracting(ScoredPoint::id).containsExactly("a", "c");
        assertThat(result.totalCount()).isEqualTo(2);
    }

    @Test
    void shouldRankFusedMatchesForQuery() throws Exception {
        CollectionHandle handle = registry.ensure(MemoryCategory.MEMORIES);
        backend.upsert(handle.name(), List.of(
            point("coffee", "black coffee at night", "u1"),
            point("tea", "green tea every morning", "u1"),
            point("smoothie", "green smoothie after running", "u1")
        ));

        SearchResult result = engine.search(handle, new SearchRequest("green tea", Filter.empty(), 2, 0));

        assertThat(result.hits()).hasSize(2);
        assertThat(result.hits().get(0).id()).isEqualTo("tea");
        assertThat(result.hits().get(0).score()).isGreaterThan(result.hits().get(1).score());
        assertThat(result.totalCount()).isEqualTo(3);
    }

    @Test
    void shouldSliceFusedRankingIntoContiguousPages() throws Exception {
        CollectionHandle handle = registry.ensure(MemoryCategory.MEMORIES);
        List<VectorPoint> points = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            points.add(point("p" + i, "note number " + i + " about tea", "u1"));
        }
        backend.upsert(handle.name(), points);

        List<String> full = ids(engine.search(handle, new SearchRequest("tea", Filter.empty(), 6, 0)));
        List<String> first = ids(engine.search(handle, new SearchRequest("tea", Filter.empty(), 3, 0)));
        List<String> second = ids(engine.search(handle, new SearchRequest("tea", Filter.empty(), 3, 3)));

        assertThat(first).containsExactlyElementsOf(full.subList(0, 3));
        assertThat(second).containsExactlyElementsOf(full.subList(3, 6));
    }

    @Test
    void shouldKeepPagesContiguousBeyondCandidateDepth() throws Exception {
        CollectionHandle handle = registry.ensure(MemoryCategory.MEMORIES);
        List<VectorPoint> points = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            points.add(point("p" + i, "note note note " + "tea ".repeat(i + 1), "u1"));
        }
        backend.upsert(handle.name(), points);

        List<String> full = ids(engine.search(handle, new SearchRequest("tea", Filter.empty(), 150, 0)));
        List<String> paged = new ArrayList<>();
        for (int offset = 0; offset < 150; offset += 20) {
            SearchResult page = engine.search(handle, new SearchRequest("tea", Filter.empty(), 20, offset));
            assertThat(page.totalCount()).isEqualTo(150);
            paged.addAll(ids(page));
        }

        assertThat(full).hasSize(150).doesNotHaveDuplicates();
        assertThat(paged).containsExactlyElementsOf(full);
    }

    @Test
    void shouldFallBackToDenseWhenCollectionHasNoSparseVector() throws Exception {
        CollectionRegistry denseOnly = new CollectionRegistry(backend, "dense", new CollectionSchema(256, Distance.COSINE, false));
        CollectionHandle handle = denseOnly.ensure(MemoryCategory.MEMORIES);
        backend.upsert(handle.name(), List.of(point("tea", "green tea", "u1")));

        SearchResult result = engine.search(handle, new SearchRequest("green tea", Filter.empty(), 5, 0));

        assertThat(result.hits()).extracting(ScoredPoint::id).containsExactly("tea");
    }

    @Test
    void shouldRejectSparseModeWithoutSparseVector() throws Exception {
        CollectionRegistry denseOnly = new CollectionRegistry(backend, "dense", new CollectionSchema(256, Distance.COSINE, false));
        CollectionHandle handle = denseOnly.ensure(MemoryCategory.MEMORIES);
        HybridRetrievalEngine sparseEngine = new HybridRetrievalEngine(
            backend,
            embeddings,
            RetrievalMode.SPARSE,
            new ReciprocalRankFusion(),
            HybridRetrievalEngine.DEFAULT_CANDIDATE_DEPTH
        );

        assertThatThrownBy(() -> sparseEngine.search(handle, new SearchRequest("tea", Filter.empty(), 5, 0)))
            .isInstanceOf(IllegalStateException.class);
    }

    private void insert(CollectionHandle handle, String... contents) throws Exception {
        List<VectorPoint> points = new ArrayList<>();
        for (int i = 0; i < contents.length; i++) {
            points.add(point("id-" + i, contents[i], "u1"));
        }
        backend.upsert(handle.name(), points);
    }

    private VectorPoint point(String id, String content, String userId) {
        return new VectorPoint(
            id,
            embeddings.embedDense(content),
            embeddings.embedSparse(content),
            Map.of("memory", content, "user_id", userId)
        );
    }

    private static List<String> ids(SearchResult result) {
        return result.hits().stream().map(ScoredPoint::id).toList();
    }
}
