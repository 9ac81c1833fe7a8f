package io.mnemo.core.collection;

import io.mnemo.core.vector.CollectionSchema;

public record CollectionHandle(MemoryCategory category, String name, CollectionSchema schema) {
}
