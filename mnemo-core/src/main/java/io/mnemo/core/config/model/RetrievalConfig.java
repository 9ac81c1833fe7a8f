package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrievalConfig(
    String mode,
    @JsonAlias({"rrf_k"}) int rrfK,
    @JsonAlias({"candidate_depth"}) int candidateDepth,
    @JsonAlias({"sort_scope"}) String sortScope
) {

    public static RetrievalConfig defaults() {
        return new RetrievalConfig("hybrid", 60, 50, "global");
    }
}
