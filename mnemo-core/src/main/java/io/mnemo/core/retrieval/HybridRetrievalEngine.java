package io.mnemo.core.retrieval;

import io.mnemo.core.collection.CollectionHandle;
import io.mnemo.core.embedding.EmbeddingProvider;
import io.mnemo.core.vector.ScoredPoint;
import io.mnemo.core.vector.VectorBackend;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HybridRetrievalEngine {
    private static final Logger LOG = LoggerFactory.getLogger(HybridRetrievalEngine.class);
    public static final int DEFAULT_CANDIDATE_DEPTH = 50;

    private final VectorBackend backend;
    private final EmbeddingProvider embeddings;
    private final RetrievalMode mode;
    private final ReciprocalRankFusion fusion;
    private final int candidateDepth;

    public HybridRetrievalEngine(VectorBackend backend, EmbeddingProvider embeddings) {
        this(backend, embeddings, RetrievalMode.HYBRID, new ReciprocalRankFusion(), DEFAULT_CANDIDATE_DEPTH);
    }

    public HybridRetrievalEngine(
        VectorBackend backend,
        EmbeddingProvider embeddings,
        RetrievalMode mode,
        ReciprocalRankFusion fusion,
        int candidateDepth
    ) {
        if (candidateDepth <= 0) {
            throw new IllegalArgumentException("candidateDepth must be positive: " + candidateDepth);
        }
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.fusion = Objects.requireNonNull(fusion, "fusion must not be null");
        this.candidateDepth = candidateDepth;
    }

    public RetrievalMode mode() {
        return mode;
    }

    public SearchResult search(CollectionHandle handle, SearchRequest request) throws IOException {
        if (!backend.collectionExists(handle.name())) {
            LOG.debug("Collection {} is not provisioned yet, returning no matches", handle.name());
            return SearchResult.empty();
        }
        return request.hasQuery() ? similarity(handle, request) : scan(handle, request);
    }

    private SearchResult scan(CollectionHandle handle, SearchRequest request) throws IOException {
        long total = backend.count(handle.name(), request.filter());
        int limit = request.limit() == null ? (int) Math.min(total, Integer.MAX_VALUE) : request.limit();
        List<ScoredPoint> hits = limit == 0 || request.offset() >= total
            ? List.of()
            : backend.scroll(handle.name(), request.filter(), limit, request.offset());
        LOG.debug("Scroll on {} returned {} of {} matches", handle.name(), hits.size(), total);
        return new SearchResult(hits, total);
    }

    private SearchResult similarity(CollectionHandle handle, SearchRequest request) throws IOException {
        RetrievalMode effective = effectiveMode(handle);
        int window = request.limit() == null ? 0 : request.offset() + request.limit();
        int depth = Math.max(Math.max(window, candidateDepth), request.depth());

        List<List<ScoredPoint>> rankings = new ArrayList<>(2);
        if (effective != RetrievalMode.SPARSE) {
            float[] dense = embeddings.embedDense(request.queryText());
            rankings.add(backend.searchDense(handle.name(), dense, request.filter(), depth));
        }
        if (effective != RetrievalMode.DENSE) {
            rankings.add(backend.searchSparse(
                handle.name(),
                embeddings.embedSparse(request.queryText()),
                request.filter(),
                depth
            ));
        }

        List<FusedHit> fused = fusion.fuse(rankings);
        long total = backend.count(handle.name(), request.filter());

        int from = Math.min(request.offset(), fused.size());
        int to = request.limit() == null ? fused.size() : Math.min(fused.size(), from + request.limit());
        List<ScoredPoint> page = new ArrayList<>(to - from);
        for (FusedHit hit : fused.subList(from, to)) {
            page.add(new ScoredPoint(hit.id(), hit.score(), hit.payload()));
        }
        LOG.debug(
            "{} search on {} fused {} candidates, returning {} (total {})",
            effective,
            handle.name(),
            fused.size(),
            page.size(),
            total
        );
        return new SearchResult(page, total);
    }

    private RetrievalMode effectiveMode(CollectionHandle handle) {
        if (handle.schema().sparseEnabled()) {
            return mode;
        }
        if (mode == RetrievalMode.SPARSE) {
            throw new IllegalStateException(
                "Sparse retrieval requested but collection " + handle.name() + " has no sparse vector"
            );
        }
        return RetrievalMode.DENSE;
    }
}
