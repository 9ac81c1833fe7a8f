package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheConfig(
    String type,
    String host,
    int port,
    String password,
    @JsonAlias({"ttl_seconds"}) long ttlSeconds,
    @JsonAlias({"key_prefix"}) String keyPrefix
) {

    public static CacheConfig defaults() {
        return new CacheConfig("memory", "localhost", 6379, "", 60, "mnemo:stm:");
    }

    public boolean redis() {
        return "redis".equalsIgnoreCase(type == null ? "" : type.trim());
    }
}
