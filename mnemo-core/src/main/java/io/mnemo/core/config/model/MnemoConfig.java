package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemoConfig(
    VectorConfig vector,
    EmbeddingConfig embedding,
    RetrievalConfig retrieval,
    CacheConfig cache,
    GatewayConfig gateway
) {

    public static MnemoConfig defaults() {
        return new MnemoConfig(
            VectorConfig.defaults(),
            EmbeddingConfig.defaults(),
            RetrievalConfig.defaults(),
            CacheConfig.defaults(),
            GatewayConfig.defaults()
        );
    }

    public MnemoConfig withVector(VectorConfig vector) {
        return new MnemoConfig(vector, embedding, retrieval, cache, gateway);
    }
}
