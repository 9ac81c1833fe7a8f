package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(
    String provider,
    String model,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    int dimensions
) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("hashing", "text-embedding-3-small", "", "https://api.openai.com/v1", 384);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
