package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VectorConfig(
    String backend,
    String url,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"collection_prefix"}) String collectionPrefix,
    String distance,
    @JsonAlias({"sparse_enabled"}) boolean sparseEnabled,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static VectorConfig defaults() {
        return new VectorConfig("qdrant", "http://localhost:6333", "", "mnemo", "cosine", true, 30);
    }

    public boolean inMemory() {
        return "memory".equalsIgnoreCase(backend == null ? "" : backend.trim());
    }

    public VectorConfig withConnection(String url, String apiKey) {
        return new VectorConfig(backend, url, apiKey, collectionPrefix, distance, sparseEnabled, timeoutSeconds);
    }
}
