package io.mnemo.core.retrieval;

import io.mnemo.core.vector.ScoredPoint;
import java.util.List;

public record SearchResult(List<ScoredPoint> hits, long totalCount) {
    private static final SearchResult EMPTY = new SearchResult(List.of(), 0);

    public SearchResult {
        hits = List.copyOf(hits);
    }

    public static SearchResult empty() {
        return EMPTY;
    }
}
