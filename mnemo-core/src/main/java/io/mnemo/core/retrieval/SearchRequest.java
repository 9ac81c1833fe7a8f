package io.mnemo.core.retrieval;

import io.mnemo.core.filter.Filter;

public record SearchRequest(String queryText, Filter filter, Integer limit, int offset, int depth) {

    public SearchRequest {
        filter = filter == null ? Filter.empty() : filter;
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
    }

    public SearchRequest(String queryText, Filter filter, Integer limit, int offset) {
        this(queryText, filter, limit, offset, 0);
    }

    public boolean hasQuery() {
        return queryText != null && !queryText.isBlank();
    }
}
