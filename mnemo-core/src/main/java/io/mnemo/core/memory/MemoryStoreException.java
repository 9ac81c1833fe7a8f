package io.mnemo.core.memory;

import io.mnemo.core.collection.MemoryCategory;
import java.io.IOException;

public class MemoryStoreException extends IOException {
    private final MemoryCategory category;
    private final String operation;

    public MemoryStoreException(MemoryCategory category, String operation, Throwable cause) {
        super("Memory " + operation + " failed for category '" + category.key() + "': " + cause.getMessage(), cause);
        this.category = category;
        this.operation = operation;
    }

    public MemoryCategory category() {
        return category;
    }

    public String operation() {
        return operation;
    }
}
