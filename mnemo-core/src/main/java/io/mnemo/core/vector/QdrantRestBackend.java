package io.mnemo.core.vector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.embedding.SparseVector;
import io.mnemo.core.filter.Condition;
import io.mnemo.core.filter.Filter;
import io.mnemo.core.filter.MatchAny;
import io.mnemo.core.filter.MatchValue;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class QdrantRestBackend implements VectorBackend {
    private static final Logger LOG = LoggerFactory.getLogger(QdrantRestBackend.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {
    };
    private static final int SCROLL_BATCH = 256;

    private final HttpUrl baseUrl;
    private final String apiKey;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public QdrantRestBackend(OkHttpClient client, String url, String apiKey) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Qdrant url must be configured");
        }
        HttpUrl parsed = HttpUrl.parse(url.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Qdrant url: " + url);
        }
        this.baseUrl = parsed;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public boolean collectionExists(String collection) throws IOException {
        JsonNode result = execute(collection, "exists", get(url(collection, "exists")));
        return result.path("exists").asBoolean(false);
    }

    @Override
    public void createCollection(String collection, CollectionSchema schema) throws IOException {
        Map<String, Object> dense = new LinkedHashMap<>();
        dense.put("size", schema.denseDimensions());
        dense.put("distance", schema.distance().wireName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vectors", Map.of(CollectionSchema.DENSE_VECTOR, dense));
        if (schema.sparseEnabled()) {
            body.put("sparse_vectors", Map.of(CollectionSchema.SPARSE_VECTOR, Map.of("modifier", "idf")));
        }
        execute(collection, "create collection", put(url(collection), body));
        LOG.debug("Created Qdrant collection {} with {}", collection, schema);
    }

    @Override
    public void createPayloadIndex(String collection, String field, PayloadSchemaType type) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field_name", field);
        body.put("field_schema", type.wireName());
        execute(collection, "create payload index", put(waitUrl(collection, "index"), body));
    }

    @Override
    public void upsert(String collection, List<VectorPoint> points) throws IOException {
        if (points.isEmpty()) {
            return;
        }
        List<Map<String, Object>> wire = new ArrayList<>(points.size());
        for (VectorPoint point : points) {
            Map<String, Object> vectors = new LinkedHashMap<>();
            vectors.put(CollectionSchema.DENSE_VECTOR, point.dense());
            if (!point.sparse().isEmpty()) {
                vectors.put(CollectionSchema.SPARSE_VECTOR, toWire(point.sparse()));
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", point.id());
            row.put("vector", vectors);
            row.put("payload", point.payload());
            wire.add(row);
        }
        execute(collection, "upsert", put(waitUrl(collection, "points"), Map.of("points", wire)));
    }

    @Override
    public List<ScoredPoint> searchDense(String collection, float[] vector, Filter filter, int limit) throws IOException {
        return query(collection, "dense search", vector, CollectionSchema.DENSE_VECTOR, filter, limit);
    }

    @Override
    public List<ScoredPoint> searchSparse(String collection, SparseVector vector, Filter filter, int limit)
        throws IOException {
        if (vector.isEmpty()) {
            return List.of();
        }
        return query(collection, "sparse search", toWire(vector), CollectionSchema.SPARSE_VECTOR, filter, limit);
    }

    @Override
    public long count(String collection, Filter filter) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        putFilter(body, filter);
        body.put("exact", true);
        JsonNode result = execute(collection, "count", post(url(collection, "points", "count"), body));
        return result.path("count").asLong(0);
    }

    @Override
    public List<ScoredPoint> scroll(String collection, Filter filter, int limit, int offset) throws IOException {
        List<ScoredPoint> out = new ArrayList<>();
        int toSkip = Math.max(0, offset);
        int remaining = limit;
        JsonNode cursor = null;
        while (remaining > 0) {
            boolean skipping = toSkip > 0;
            int batch = Math.min(skipping ? toSkip : remaining, SCROLL_BATCH);

            Map<String, Object> body = new LinkedHashMap<>();
            putFilter(body, filter);
            body.put("limit", batch);
            if (cursor != null) {
                body.put("offset", cursor);
            }
            body.put("with_payload", !skipping);
            body.put("with_vector", false);

            JsonNode result = execute(collection, "scroll", post(url(collection, "points", "scroll"), body));
            List<ScoredPoint> points = parsePoints(result.path("points"));
            if (skipping) {
                toSkip -= points.size();
            } else {
                out.addAll(points);
                remaining -= points.size();
            }

            JsonNode next = result.path("next_page_offset");
            if (points.isEmpty() || next.isMissingNode() || next.isNull()) {
                break;
            }
            cursor = next;
        }
        return out;
    }

    @Override
    public List<ScoredPoint> retrieve(String collection, List<String> ids) throws IOException {
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ids", ids);
        body.put("with_payload", true);
        body.put("with_vector", false);
        JsonNode result = execute(collection, "retrieve", post(url(collection, "points"), body));
        return parsePoints(result);
    }

    @Override
    public void delete(String collection, List<String> ids) throws IOException {
        if (ids.isEmpty()) {
            return;
        }
        execute(collection, "delete", post(waitUrl(collection, "points", "delete"), Map.of("points", ids)));
    }

    @Override
    public void deleteMatching(String collection, Filter filter) throws IOException {
        Map<String, Object> body = Map.of("filter", toWire(filter));
        execute(collection, "delete by filter", post(waitUrl(collection, "points", "delete"), body));
    }

    private List<ScoredPoint> query(
        String collection,
        String operation,
        Object query,
        String using,
        Filter filter,
        int limit
    ) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("using", using);
        putFilter(body, filter);
        body.put("limit", limit);
        body.put("with_payload", true);
        JsonNode result = execute(collection, operation, post(url(collection, "points", "query"), body));
        return parsePoints(result.path("points"));
    }

    private JsonNode execute(String collection, String operation, Request.Builder builder) throws IOException {
        if (!apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        Request request = builder.header("Accept", "application/json").build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new VectorBackendException(collection, operation, response.code(), "HTTP " + response.code() + " " + errorMessage(raw));
            }
            if (raw.isBlank()) {
                return mapper.createObjectNode();
            }
            return mapper.readTree(raw).path("result");
        } catch (VectorBackendException | InterruptedIOException e) {
            throw e;
        } catch (IOException e) {
            throw new VectorBackendException(collection, operation, e.getMessage() == null ? e.toString() : e.getMessage(), e);
        }
    }

    private String errorMessage(String raw) {
        try {
            JsonNode error = mapper.readTree(raw).path("status").path("error");
            if (error.isTextual()) {
                return error.asText();
            }
        } catch (Exception ignored) {
            // not JSON, fall through to the raw body
        }
        return raw;
    }

    private List<ScoredPoint> parsePoints(JsonNode array) {
        List<ScoredPoint> points = new ArrayList<>();
        if (!array.isArray()) {
            return points;
        }
        for (JsonNode node : array) {
            Map<String, Object> payload = node.path("payload").isObject()
                ? mapper.convertValue(node.path("payload"), PAYLOAD)
                : Map.of();
            points.add(new ScoredPoint(node.path("id").asText(), node.path("score").asDouble(0.0), payload));
        }
        return points;
    }

    private void putFilter(Map<String, Object> body, Filter filter) {
        if (filter != null && !filter.isEmpty()) {
            body.put("filter", toWire(filter));
        }
    }

    private Map<String, Object> toWire(Filter filter) {
        if (filter == null || filter.isEmpty()) {
            return Map.of();
        }
        List<Map<String, Object>> must = new ArrayList<>();
        for (Condition condition : filter.must()) {
            Map<String, Object> match;
            if (condition instanceof MatchValue value) {
                match = Map.of("value", value.value());
            } else if (condition instanceof MatchAny any) {
                match = Map.of("any", any.values());
            } else {
                throw new IllegalArgumentException("Unsupported condition: " + condition);
            }
            must.add(Map.of("key", condition.key(), "match", match));
        }
        return Map.of("must", must);
    }

    private Map<String, Object> toWire(SparseVector vector) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("indices", vector.indices());
        wire.put("values", vector.values());
        return wire;
    }

    private HttpUrl url(String collection, String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder()
            .addPathSegment("collections")
            .addPathSegment(collection);
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private HttpUrl waitUrl(String collection, String... segments) {
        return url(collection, segments).newBuilder()
            .addQueryParameter("wait", "true")
            .build();
    }

    private Request.Builder get(HttpUrl url) {
        return new Request.Builder().url(url).get();
    }

    private Request.Builder put(HttpUrl url, Object body) throws IOException {
        return new Request.Builder().url(url).put(RequestBody.create(mapper.writeValueAsString(body), JSON));
    }

    private Request.Builder post(HttpUrl url, Object body) throws IOException {
        return new Request.Builder().url(url).post(RequestBody.create(mapper.writeValueAsString(body), JSON));
    }
}
