package io.mnemo.core.filter;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record MatchAny(String key, List<String> values) implements Condition {

    public MatchAny {
        Objects.requireNonNull(key, "key must not be null");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
    }

    @Override
    public boolean test(Map<String, ?> payload) {
        Object actual = payload.get(key);
        if (actual instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && values.contains(String.valueOf(item))) {
                    return true;
                }
            }
            return false;
        }
        return actual != null && values.contains(String.valueOf(actual));
    }
}
