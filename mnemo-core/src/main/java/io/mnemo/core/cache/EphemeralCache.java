package io.mnemo.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-term key/value memory with one time-to-live for every entry. Expired entries are never
 * returned; reclaiming them is left to the backing store.
 */
public interface EphemeralCache extends AutoCloseable {
    Duration DEFAULT_TTL = Duration.ofSeconds(60);

    void put(String key, String value);

    Optional<String> get(String key);

    Duration ttl();

    @Override
    default void close() {
    }
}
