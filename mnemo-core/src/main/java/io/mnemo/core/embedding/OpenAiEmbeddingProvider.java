package io.mnemo.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public final class OpenAiEmbeddingProvider implements EmbeddingProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final int dimensions;
    private final boolean sendDimensions;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiEmbeddingProvider(OkHttpClient client, String apiKey, String apiBase, String model, int dimensions) {
        this(client, apiKey, apiBase, model, dimensions, false);
    }

    public OpenAiEmbeddingProvider(
        OkHttpClient client,
        String apiKey,
        String apiBase,
        String model,
        int dimensions,
        boolean sendDimensions
    ) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey is required for the openai embedding provider");
        }
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive: " + dimensions);
        }
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.apiKey = apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.dimensions = dimensions;
        this.sendDimensions = sendDimensions;
        this.mapper = new ObjectMapper();
    }

    @Override
    public float[] embedDense(String text) throws IOException {
        if (text == null || text.isBlank()) {
            return new float[dimensions];
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", text);
        if (sendDimensions) {
            payload.put("dimensions", dimensions);
        }

        Request request = new Request.Builder()
            .url(embeddingsUrl())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json")
            .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new EmbeddingException("Embedding request failed: HTTP " + response.code() + " " + raw);
            }
            return parse(raw);
        } catch (EmbeddingException | InterruptedIOException e) {
            throw e;
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request to " + apiBase + " failed", e);
        }
    }

    @Override
    public SparseVector embedSparse(String text) {
        return HashingEmbeddingProvider.sparse(text);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return "openai/" + model;
    }

    private float[] parse(String raw) throws EmbeddingException {
        JsonNode embedding;
        try {
            embedding = mapper.readTree(raw).path("data").path(0).path("embedding");
        } catch (IOException e) {
            throw new EmbeddingException("Malformed embedding response", e);
        }
        if (!embedding.isArray()) {
            throw new EmbeddingException("Embedding response has no data[0].embedding array");
        }
        if (embedding.size() != dimensions) {
            throw new EmbeddingException(
                "Embedding dimension mismatch: expected " + dimensions + " but model returned " + embedding.size()
            );
        }
        float[] vector = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            vector[i] = (float) embedding.get(i).asDouble();
        }
        return vector;
    }

    private HttpUrl embeddingsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("embeddings")
            .build();
    }
}
