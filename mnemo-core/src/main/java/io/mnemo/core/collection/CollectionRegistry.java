package io.mnemo.core.collection;

import io.mnemo.core.vector.CollectionSchema;
import io.mnemo.core.vector.PayloadSchemaType;
import io.mnemo.core.vector.VectorBackend;
import io.mnemo.core.vector.VectorBackendException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CollectionRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(CollectionRegistry.class);

    static final Map<String, PayloadSchemaType> PAYLOAD_INDEXES = payloadIndexes();

    private final VectorBackend backend;
    private final String prefix;
    private final Map<MemoryCategory, CollectionSchema> schemas;

    public CollectionRegistry(VectorBackend backend, String prefix, CollectionSchema schema) {
        this(backend, prefix, uniform(Objects.requireNonNull(schema, "schema must not be null")));
    }

    public CollectionRegistry(VectorBackend backend, String prefix, Map<MemoryCategory, CollectionSchema> schemas) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("collection prefix must not be blank");
        }
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.prefix = prefix.trim();
        EnumMap<MemoryCategory, CollectionSchema> copy = new EnumMap<>(MemoryCategory.class);
        copy.putAll(schemas);
        for (MemoryCategory category : MemoryCategory.values()) {
            if (!copy.containsKey(category)) {
                throw new IllegalArgumentException("No collection schema registered for " + category.key());
            }
        }
        this.schemas = copy;
    }

    public String name(MemoryCategory category) {
        return prefix + "_" + category.key();
    }

    public CollectionHandle handle(MemoryCategory category) {
        return new CollectionHandle(category, name(category), schemas.get(category));
    }

    public boolean exists(MemoryCategory category) throws IOException {
        return backend.collectionExists(name(category));
    }

    public CollectionHandle ensure(MemoryCategory category) throws IOException {
        CollectionHandle handle = handle(category);
        if (backend.collectionExists(handle.name())) {
            return handle;
        }

        try {
            backend.createCollection(handle.name(), handle.schema());
        } catch (VectorBackendException e) {
            if (createdConcurrently(handle.name())) {
                LOG.info("Collection {} was created concurrently", handle.name());
                return handle;
            }
            throw e;
        }
        LOG.info(
            "Created collection {} (dense={} distance={} sparse={})",
            handle.name(),
            handle.schema().denseDimensions(),
            handle.schema().distance(),
            handle.schema().sparseEnabled()
        );

        createPayloadIndexes(handle.name());
        return handle;
    }

    private void createPayloadIndexes(String collection) throws InterruptedIOException {
        for (Map.Entry<String, PayloadSchemaType> index : PAYLOAD_INDEXES.entrySet()) {
            try {
                backend.createPayloadIndex(collection, index.getKey(), index.getValue());
            } catch (InterruptedIOException e) {
                throw e;
            } catch (IOException e) {
                LOG.warn("Failed to create payload index {} on {}: {}", index.getKey(), collection, e.getMessage());
            }
        }
    }

    private boolean createdConcurrently(String collection) {
        try {
            return backend.collectionExists(collection);
        } catch (IOException recheck) {
            LOG.debug("Existence re-check for {} failed: {}", collection, recheck.getMessage());
            return false;
        }
    }

    private static Map<MemoryCategory, CollectionSchema> uniform(CollectionSchema schema) {
        Map<MemoryCategory, CollectionSchema> all = new EnumMap<>(MemoryCategory.class);
        for (MemoryCategory category : MemoryCategory.values()) {
            all.put(category, schema);
        }
        return all;
    }

    private static Map<String, PayloadSchemaType> payloadIndexes() {
        Map<String, PayloadSchemaType> indexes = new LinkedHashMap<>();
        indexes.put("user_id", PayloadSchemaType.KEYWORD);
        indexes.put("agent_id", PayloadSchemaType.KEYWORD);
        indexes.put("team_id", PayloadSchemaType.KEYWORD);
        indexes.put("topics", PayloadSchemaType.KEYWORD);
        indexes.put("updated_at", PayloadSchemaType.INTEGER);
        return Collections.unmodifiableMap(indexes);
    }
}
