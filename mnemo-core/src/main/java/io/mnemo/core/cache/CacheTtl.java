package io.mnemo.core.cache;

import java.time.Duration;

final class CacheTtl {

    private CacheTtl() {
    }

    static Duration validate(Duration ttl) {
        if (ttl == null) {
            return EphemeralCache.DEFAULT_TTL;
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        return ttl;
    }
}
