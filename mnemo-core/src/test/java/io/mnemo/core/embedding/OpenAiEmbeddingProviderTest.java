package io.mnemo.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiEmbeddingProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldRequestEmbeddingAndParseVector() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "data": [ { "index": 0, "embedding": [0.5, -0.25, 1.0] } ],
                  "model": "text-embedding-3-small"
                }
                """));

        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider(
            new OkHttpClient(),
            "sk-test",
            server.url("/v1").toString(),
            "text-embedding-3-small",
            3,
            true
        );

        float[] vector = provider.embedDense("likes hiking");

        assertThat(vector).containsExactly(0.5f, -0.25f, 1.0f);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/embeddings");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"text-embedding-3-small\"");
        assertThat(body).contains("\"input\":\"likes hiking\"");
        assertThat(body).contains("\"dimensions\":3");
    }

    @Test
    void shouldFailOnDimensionMismatch() {
        server.enqueue(new MockResponse().setBody("{\"data\":[{\"embedding\":[0.1, 0.2]}]}"));
        OpenAiEmbeddingProvider provider = provider(3);

        assertThatThrownBy(() -> provider.embedDense("text"))
            .isInstanceOf(EmbeddingException.class)
            .hasMessageContaining("expected 3");
    }

    @Test
    void shouldFailOnHttpError() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid key\"}"));
        OpenAiEmbeddingProvider provider = provider(3);

        assertThatThrownBy(() -> provider.embedDense("text"))
            .isInstanceOf(EmbeddingException.class)
            .hasMessageContaining("401");
    }

    @Test
    void shouldPropagateTimeoutWithoutWrapping() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        OkHttpClient client = new OkHttpClient.Builder().readTimeout(Duration.ofMillis(200)).build();
        OpenAiEmbeddingProvider provider =
            new OpenAiEmbeddingProvider(client, "sk-test", server.url("/v1").toString(), "m", 3);

        assertThatThrownBy(() -> provider.embedDense("text"))
            .isInstanceOf(InterruptedIOException.class)
            .isNotInstanceOf(EmbeddingException.class);
    }

    @Test
    void shouldSkipRemoteCallForBlankText() throws Exception {
        float[] vector = provider(4).embedDense("  ");

        assertThat(vector).containsExactly(0f, 0f, 0f, 0f);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldRequireApiKey() {
        assertThatThrownBy(() -> new OpenAiEmbeddingProvider(new OkHttpClient(), " ", server.url("/v1").toString(), "m", 3))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldBuildSparseVectorsLocally() {
        SparseVector sparse = provider(3).embedSparse("green tea");

        assertThat(sparse).isEqualTo(new HashingEmbeddingProvider().embedSparse("green tea"));
        assertThat(server.getRequestCount()).isZero();
    }

    private OpenAiEmbeddingProvider provider(int dimensions) {
        return new OpenAiEmbeddingProvider(new OkHttpClient(), "sk-test", server.url("/v1").toString(), "m", dimensions);
    }
}
