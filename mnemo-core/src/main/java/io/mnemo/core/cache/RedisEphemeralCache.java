package io.mnemo.core.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

public final class RedisEphemeralCache implements EphemeralCache {
    public static final String DEFAULT_KEY_PREFIX = "mnemo:stm:";

    private final StringRedisTemplate redis;
    private final Duration ttl;
    private final String keyPrefix;
    private final LettuceConnectionFactory connectionFactory;
    private final AtomicBoolean closed = new AtomicBoolean();

    public RedisEphemeralCache(StringRedisTemplate redis, Duration ttl, String keyPrefix) {
        this(redis, ttl, keyPrefix, null);
    }

    // connectionFactory is owned by the cache and destroyed on close; null when the caller owns it
    RedisEphemeralCache(StringRedisTemplate redis, Duration ttl, String keyPrefix, LettuceConnectionFactory connectionFactory) {
        this.redis = Objects.requireNonNull(redis, "redis must not be null");
        this.ttl = CacheTtl.validate(ttl);
        this.keyPrefix = keyPrefix == null ? DEFAULT_KEY_PREFIX : keyPrefix;
        this.connectionFactory = connectionFactory;
    }

    public static RedisEphemeralCache connect(String host, int port, String password, Duration ttl, String keyPrefix) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Redis host must be configured");
        }
        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(host.trim(), port);
        if (password != null && !password.isBlank()) {
            configuration.setPassword(password);
        }
        LettuceConnectionFactory factory = new LettuceConnectionFactory(configuration);
        factory.afterPropertiesSet();
        factory.start();
        return new RedisEphemeralCache(new StringRedisTemplate(factory), ttl, keyPrefix, factory);
    }

    @Override
    public void put(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        redis.opsForValue().set(key(key), value, ttl);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key(key)));
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public void close() {
        if (connectionFactory != null && closed.compareAndSet(false, true)) {
            connectionFactory.destroy();
        }
    }

    private String key(String key) {
        return keyPrefix + key;
    }
}
