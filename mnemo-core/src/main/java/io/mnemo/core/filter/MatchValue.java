package io.mnemo.core.filter;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

public record MatchValue(String key, String value) implements Condition {

    public MatchValue {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public boolean test(Map<String, ?> payload) {
        Object actual = payload.get(key);
        if (actual instanceof Collection<?> values) {
            return values.stream().anyMatch(item -> value.equals(String.valueOf(item)));
        }
        return actual != null && value.equals(String.valueOf(actual));
    }
}
