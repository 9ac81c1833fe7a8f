package io.mnemo.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryEphemeralCache implements EphemeralCache {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryEphemeralCache() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    public InMemoryEphemeralCache(Duration ttl, Clock clock) {
        this.ttl = CacheTtl.validate(ttl);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void put(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    private record Entry(String value, Instant expiresAt) {
    }
}
