package io.mnemo.core.memory;

import java.util.List;

public record MemoryQuery(
    String userId,
    String agentId,
    String teamId,
    List<String> topics,
    String queryText,
    Integer limit,
    Integer page,
    SortField sortBy,
    SortOrder sortOrder
) {

    public MemoryQuery {
        topics = topics == null ? List.of() : List.copyOf(topics);
        sortOrder = sortOrder == null ? SortOrder.ASC : sortOrder;
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        if (page != null && page < 1) {
            throw new IllegalArgumentException("page must be at least 1: " + page);
        }
    }

    public static MemoryQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int offset() {
        if (limit == null || page == null) {
            return 0;
        }
        return Math.multiplyExact(page - 1, limit);
    }

    public static final class Builder {
        private String userId;
        private String agentId;
        private String teamId;
        private List<String> topics;
        private String queryText;
        private Integer limit;
        private Integer page;
        private SortField sortBy;
        private SortOrder sortOrder;

        private Builder() {
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder teamId(String teamId) {
            this.teamId = teamId;
            return this;
        }

        public Builder topics(List<String> topics) {
            this.topics = topics;
            return this;
        }

        public Builder queryText(String queryText) {
            this.queryText = queryText;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder page(Integer page) {
            this.page = page;
            return this;
        }

        public Builder sortBy(SortField sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        public Builder sortOrder(SortOrder sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }

        public MemoryQuery build() {
            return new MemoryQuery(userId, agentId, teamId, topics, queryText, limit, page, sortBy, sortOrder);
        }
    }
}
