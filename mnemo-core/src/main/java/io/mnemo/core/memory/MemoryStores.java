package io.mnemo.core.memory;

import io.mnemo.core.collection.CollectionRegistry;
import io.mnemo.core.collection.MemoryCategory;
import io.mnemo.core.embedding.EmbeddingProvider;
import io.mnemo.core.retrieval.HybridRetrievalEngine;
import io.mnemo.core.vector.VectorBackend;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

public final class MemoryStores {
    private final Map<MemoryCategory, MemoryStore> stores;

    public MemoryStores(Map<MemoryCategory, ? extends MemoryStore> stores) {
        EnumMap<MemoryCategory, MemoryStore> copy = new EnumMap<>(MemoryCategory.class);
        copy.putAll(stores);
        for (MemoryCategory category : MemoryCategory.values()) {
            if (!copy.containsKey(category)) {
                throw new IllegalArgumentException("No memory store for category " + category.key());
            }
        }
        this.stores = copy;
    }

    public static MemoryStores hybrid(
        VectorBackend backend,
        CollectionRegistry registry,
        HybridRetrievalEngine engine,
        EmbeddingProvider embeddings,
        Clock clock,
        SortScope sortScope
    ) {
        Map<MemoryCategory, MemoryStore> stores = new EnumMap<>(MemoryCategory.class);
        for (MemoryCategory category : MemoryCategory.values()) {
            stores.put(category, new HybridMemoryStore(category, backend, registry, engine, embeddings, clock, sortScope));
        }
        return new MemoryStores(stores);
    }

    public MemoryStore forCategory(MemoryCategory category) {
        return stores.get(category);
    }
}
