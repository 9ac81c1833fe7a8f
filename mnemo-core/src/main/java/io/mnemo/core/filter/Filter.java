package io.mnemo.core.filter;

import java.util.List;
import java.util.Map;

public record Filter(List<Condition> must) {
    private static final Filter EMPTY = new Filter(List.of());

    public Filter {
        must = must == null ? List.of() : List.copyOf(must);
    }

    public static Filter empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return must.isEmpty();
    }

    public boolean matches(Map<String, ?> payload) {
        for (Condition condition : must) {
            if (!condition.test(payload)) {
                return false;
            }
        }
        return true;
    }
}
