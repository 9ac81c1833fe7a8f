package io.mnemo.core.vector;

import io.mnemo.core.embedding.SparseVector;
import io.mnemo.core.filter.Filter;
import java.io.IOException;
import java.util.List;

/**
 * Boundary to the vector database. Implementations are safe for concurrent use.
 */
public interface VectorBackend {

    boolean collectionExists(String collection) throws IOException;

    void createCollection(String collection, CollectionSchema schema) throws IOException;

    void createPayloadIndex(String collection, String field, PayloadSchemaType type) throws IOException;

    void upsert(String collection, List<VectorPoint> points) throws IOException;

    List<ScoredPoint> searchDense(String collection, float[] vector, Filter filter, int limit) throws IOException;

    List<ScoredPoint> searchSparse(String collection, SparseVector vector, Filter filter, int limit) throws IOException;

    long count(String collection, Filter filter) throws IOException;

    /**
     * Metadata-only scan in a stable order, skipping {@code offset} matches and returning at most
     * {@code limit}.
     */
    List<ScoredPoint> scroll(String collection, Filter filter, int limit, int offset) throws IOException;

    List<ScoredPoint> retrieve(String collection, List<String> ids) throws IOException;

    void delete(String collection, List<String> ids) throws IOException;

    void deleteMatching(String collection, Filter filter) throws IOException;
}
