package io.mnemo.core.memory;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Long-term memory for one category.
 */
public interface MemoryStore {

    /**
     * Writes the whole record, replacing any previous payload and vectors stored under the same
     * id. A record without an id gets a fresh one. Returns the record as stored.
     */
    MemoryRecord upsert(MemoryRecord record) throws IOException;

    Optional<MemoryRecord> get(String memoryId) throws IOException;

    MemoryPage list(MemoryQuery query) throws IOException;

    /**
     * Similarity search over every record in the category, best match first.
     */
    List<ScoredMemory> recall(String queryText, int limit) throws IOException;

    void delete(String memoryId) throws IOException;

    void deleteMany(Collection<String> memoryIds) throws IOException;

    void clear() throws IOException;

    long count() throws IOException;
}
