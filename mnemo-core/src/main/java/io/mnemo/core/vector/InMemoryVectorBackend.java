package io.mnemo.core.vector;

import io.mnemo.core.embedding.SparseVector;
import io.mnemo.core.filter.Filter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryVectorBackend implements VectorBackend {
    private final Map<String, StoredCollection> collections = new ConcurrentHashMap<>();

    @Override
    public boolean collectionExists(String collection) {
        return collections.containsKey(collection);
    }

    @Override
    public void createCollection(String collection, CollectionSchema schema) throws VectorBackendException {
        StoredCollection existing = collections.putIfAbsent(collection, new StoredCollection(schema));
        if (existing != null) {
            throw new VectorBackendException(collection, "create collection", 409, "collection already exists");
        }
    }

    @Override
    public void createPayloadIndex(String collection, String field, PayloadSchemaType type) throws VectorBackendException {
        StoredCollection stored = require(collection, "create payload index");
        synchronized (stored) {
            stored.indexes.put(field, type);
        }
    }

    @Override
    public void upsert(String collection, List<VectorPoint> points) throws VectorBackendException {
        StoredCollection stored = require(collection, "upsert");
        for (VectorPoint point : points) {
            if (point.dense().length != stored.schema.denseDimensions()) {
                throw new VectorBackendException(
                    collection,
                    "upsert",
                    400,
                    "expected dense dimension " + stored.schema.denseDimensions() + " but got " + point.dense().length
                );
            }
        }
        synchronized (stored) {
            for (VectorPoint point : points) {
                stored.points.put(point.id(), new VectorPoint(
                    point.id(),
                    point.dense().clone(),
                    stored.schema.sparseEnabled() ? point.sparse() : SparseVector.empty(),
                    new LinkedHashMap<>(point.payload())
                ));
            }
        }
    }

    @Override
    public List<ScoredPoint> searchDense(String collection, float[] vector, Filter filter, int limit)
        throws VectorBackendException {
        StoredCollection stored = require(collection, "dense search");
        Distance distance = stored.schema.distance();
        List<ScoredPoint> scored = new ArrayList<>();
        for (VectorPoint point : stored.snapshot()) {
            if (filter.matches(point.payload())) {
                scored.add(new ScoredPoint(point.id(), score(distance, vector, point.dense()), point.payload()));
            }
        }
        Comparator<ScoredPoint> byScore = Comparator.comparingDouble(ScoredPoint::score);
        scored.sort(distance.higherIsCloser() ? byScore.reversed() : byScore);
        return top(scored, limit);
    }

    @Override
    public List<ScoredPoint> searchSparse(String collection, SparseVector vector, Filter filter, int limit)
        throws VectorBackendException {
        StoredCollection stored = require(collection, "sparse search");
        if (!stored.schema.sparseEnabled()) {
            throw new VectorBackendException(collection, "sparse search", 400, "collection has no sparse vector");
        }
        List<ScoredPoint> scored = new ArrayList<>();
        for (VectorPoint point : stored.snapshot()) {
            if (!filter.matches(point.payload()) || !overlaps(vector, point.sparse())) {
                continue;
            }
            scored.add(new ScoredPoint(point.id(), vector.dot(point.sparse()), point.payload()));
        }
        scored.sort(Comparator.comparingDouble(ScoredPoint::score).reversed());
        return top(scored, limit);
    }

    @Override
    public long count(String collection, Filter filter) throws VectorBackendException {
        StoredCollection stored = require(collection, "count");
        return stored.snapshot().stream().filter(point -> filter.matches(point.payload())).count();
    }

    @Override
    public List<ScoredPoint> scroll(String collection, Filter filter, int limit, int offset) throws VectorBackendException {
        StoredCollection stored = require(collection, "scroll");
        return stored.snapshot().stream()
            .filter(point -> filter.matches(point.payload()))
            .skip(Math.max(0, offset))
            .limit(Math.max(0, limit))
            .map(point -> new ScoredPoint(point.id(), 0.0, point.payload()))
            .toList();
    }

    @Override
    public List<ScoredPoint> retrieve(String collection, List<String> ids) throws VectorBackendException {
        StoredCollection stored = require(collection, "retrieve");
        List<ScoredPoint> found = new ArrayList<>();
        synchronized (stored) {
            for (String id : new LinkedHashSet<>(ids)) {
                VectorPoint point = stored.points.get(id);
                if (point != null) {
                    found.add(new ScoredPoint(point.id(), 0.0, point.payload()));
                }
            }
        }
        return found;
    }

    @Override
    public void delete(String collection, List<String> ids) throws VectorBackendException {
        StoredCollection stored = require(collection, "delete");
        synchronized (stored) {
            ids.forEach(stored.points::remove);
        }
    }

    @Override
    public void deleteMatching(String collection, Filter filter) throws VectorBackendException {
        StoredCollection stored = require(collection, "delete by filter");
        synchronized (stored) {
            stored.points.values().removeIf(point -> filter.matches(point.payload()));
        }
    }

    Set<String> indexedFields(String collection) throws VectorBackendException {
        StoredCollection stored = require(collection, "indexes");
        synchronized (stored) {
            return Set.copyOf(stored.indexes.keySet());
        }
    }

    private StoredCollection require(String collection, String operation) throws VectorBackendException {
        StoredCollection stored = collections.get(collection);
        if (stored == null) {
            throw new VectorBackendException(collection, operation, 404, "collection not found");
        }
        return stored;
    }

    private static List<ScoredPoint> top(List<ScoredPoint> scored, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return List.copyOf(scored.subList(0, Math.min(limit, scored.size())));
    }

    private static boolean overlaps(SparseVector query, SparseVector candidate) {
        int[] a = query.indices();
        int[] b = candidate.indices();
        int i = 0;
        int j = 0;
        while (i < a.length && j < b.length) {
            if (a[i] == b[j]) {
                return true;
            }
            if (a[i] < b[j]) {
                i++;
            } else {
                j++;
            }
        }
        return false;
    }

    private static double score(Distance distance, float[] a, float[] b) {
        int dim = Math.min(a.length, b.length);
        return switch (distance) {
            case COSINE -> {
                double dot = 0.0;
                double normA = 0.0;
                double normB = 0.0;
                for (int i = 0; i < dim; i++) {
                    dot += (double) a[i] * b[i];
                    normA += (double) a[i] * a[i];
                    normB += (double) b[i] * b[i];
                }
                yield normA == 0.0 || normB == 0.0 ? 0.0 : dot / Math.sqrt(normA * normB);
            }
            case DOT -> {
                double dot = 0.0;
                for (int i = 0; i < dim; i++) {
                    dot += (double) a[i] * b[i];
                }
                yield dot;
            }
            case EUCLID -> {
                double sum = 0.0;
                for (int i = 0; i < dim; i++) {
                    double diff = (double) a[i] - b[i];
                    sum += diff * diff;
                }
                yield Math.sqrt(sum);
            }
            case MANHATTAN -> {
                double sum = 0.0;
                for (int i = 0; i < dim; i++) {
                    sum += Math.abs((double) a[i] - b[i]);
                }
                yield sum;
            }
        };
    }

    private static final class StoredCollection {
        private final CollectionSchema schema;
        private final Map<String, VectorPoint> points = new LinkedHashMap<>();
        private final Map<String, PayloadSchemaType> indexes = new LinkedHashMap<>();

        private StoredCollection(CollectionSchema schema) {
            this.schema = schema;
        }

        private synchronized List<VectorPoint> snapshot() {
            return List.copyOf(points.values());
        }
    }
}
