package io.mnemo.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.cache.EphemeralCache;
import io.mnemo.core.collection.MemoryCategory;
import io.mnemo.core.memory.MemoryPage;
import io.mnemo.core.memory.MemoryQuery;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.memory.MemoryStore;
import io.mnemo.core.memory.MemoryStoreException;
import io.mnemo.core.memory.MemoryStores;
import io.mnemo.core.memory.ScoredMemory;
import io.mnemo.core.memory.SortField;
import io.mnemo.core.memory.SortOrder;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemoryGatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryGatewayServer.class);

    private final ObjectMapper mapper;
    private final MemoryStores stores;
    private final EphemeralCache cache;
    private final String host;
    private final int requestedPort;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public MemoryGatewayServer(int port, MemoryStores stores, EphemeralCache cache) {
        this(port, "127.0.0.1", stores, cache);
    }

    public MemoryGatewayServer(int port, String host, MemoryStores stores, EphemeralCache cache) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addPrefixPath("/memories", blocking(this::handleMemories))
            .addPrefixPath("/cache", blocking(this::handleCache));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Memory gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleMemories(HttpServerExchange exchange) throws Exception {
        List<String> segments = segments(exchange.getRelativePath());
        if (segments.isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        MemoryStore store = stores.forCategory(MemoryCategory.fromKey(segments.get(0)));
        String method = exchange.getRequestMethod().toString().toUpperCase();

        if (segments.size() == 1) {
            switch (method) {
                case "GET" -> sendJson(exchange, 200, toPageResponse(store.list(parseQuery(exchange))));
                case "POST" -> {
                    MemoryRecord record = mapper.treeToValue(readJsonBody(exchange), MemoryRecord.class);
                    sendJson(exchange, 200, Map.of("record", store.upsert(record)));
                }
                case "DELETE" -> {
                    store.clear();
                    sendJson(exchange, 200, Map.of("cleared", true));
                }
                default -> sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            }
            return;
        }

        if (segments.size() == 2 && "POST".equals(method) && "delete".equals(segments.get(1))) {
            List<String> ids = new ArrayList<>();
            for (JsonNode id : readJsonBody(exchange).path("ids")) {
                ids.add(id.asText());
            }
            store.deleteMany(ids);
            sendJson(exchange, 200, Map.of("deleted", ids.size()));
            return;
        }

        if (segments.size() == 2 && "POST".equals(method) && "recall".equals(segments.get(1))) {
            JsonNode body = readJsonBody(exchange);
            List<ScoredMemory> results = store.recall(body.path("query").asText(""), body.path("limit").asInt(5));
            sendJson(exchange, 200, Map.of("results", results));
            return;
        }

        if (segments.size() == 2) {
            String memoryId = segments.get(1);
            switch (method) {
                case "GET" -> {
                    Optional<MemoryRecord> record = store.get(memoryId);
                    if (record.isPresent()) {
                        sendJson(exchange, 200, Map.of("record", record.get()));
                    } else {
                        sendJson(exchange, 404, Map.of("error", "memory_not_found", "memory_id", memoryId));
                    }
                }
                case "DELETE" -> {
                    store.delete(memoryId);
                    sendJson(exchange, 200, Map.of("deleted", 1));
                }
                default -> sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            }
            return;
        }
        sendJson(exchange, 404, Map.of("error", "not_found"));
    }

    private void handleCache(HttpServerExchange exchange) throws Exception {
        List<String> segments = segments(exchange.getRelativePath());
        if (segments.size() != 1) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        String key = segments.get(0);
        String method = exchange.getRequestMethod().toString().toUpperCase();
        switch (method) {
            case "PUT" -> {
                exchange.startBlocking();
                String value = new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
                cache.put(key, value);
                sendJson(exchange, 200, Map.of("key", key, "ttl_seconds", cache.ttl().toSeconds()));
            }
            case "GET" -> {
                Optional<String> value = cache.get(key);
                if (value.isPresent()) {
                    sendJson(exchange, 200, Map.of("key", key, "value", value.get()));
                } else {
                    sendJson(exchange, 404, Map.of("error", "cache_miss", "key", key));
                }
            }
            default -> sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
        }
    }

    private MemoryQuery parseQuery(HttpServerExchange exchange) {
        String sortBy = queryParam(exchange, "sort_by");
        return MemoryQuery.builder()
            .userId(queryParam(exchange, "user_id"))
            .agentId(queryParam(exchange, "agent_id"))
            .teamId(queryParam(exchange, "team_id"))
            .topics(topics(exchange))
            .queryText(queryParam(exchange, "q"))
            .limit(queryInt(exchange, "limit"))
            .page(queryInt(exchange, "page"))
            .sortBy(sortBy == null ? null : SortField.parse(sortBy))
            .sortOrder(SortOrder.parse(queryParam(exchange, "sort_order")))
            .build();
    }

    private Map<String, Object> toPageResponse(MemoryPage page) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("records", page.records());
        payload.put("total_count", page.totalCount());
        return payload;
    }

    private HttpHandler blocking(ExchangeHandler handler) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> handleSafely(handler, exchange));
                return;
            }
            handleSafely(handler, exchange);
        };
    }

    private void handleSafely(ExchangeHandler handler, HttpServerExchange exchange) {
        try {
            handler.handle(exchange);
        } catch (MemoryStoreException e) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("error", e.getMessage());
            payload.put("category", e.category().key());
            payload.put("operation", e.operation());
            sendQuietly(exchange, 502, payload);
        } catch (JsonProcessingException e) {
            sendQuietly(exchange, 400, Map.of("error", "invalid_json: " + e.getOriginalMessage()));
        } catch (IllegalArgumentException e) {
            sendQuietly(exchange, 400, Map.of("error", e.getMessage() == null ? "bad_request" : e.getMessage()));
        } catch (Exception e) {
            LOG.warn("Gateway request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendQuietly(exchange, 500, Map.of("error", e.getMessage() == null ? "internal_error" : e.getMessage()));
        }
    }

    private void sendQuietly(HttpServerExchange exchange, int status, Map<String, ?> payload) {
        try {
            sendJson(exchange, status, payload);
        } catch (IOException e) {
            LOG.debug("Failed to write error response: {}", e.getMessage());
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.getFirst();
        return value == null || value.isBlank() ? null : value;
    }

    private Integer queryInt(HttpServerExchange exchange, String key) {
        String raw = queryParam(exchange, key);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw, e);
        }
    }

    private List<String> topics(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("topics");
        if (values == null) {
            return List.of();
        }
        List<String> topics = new ArrayList<>();
        for (String value : values) {
            for (String topic : value.split(",")) {
                if (!topic.isBlank()) {
                    topics.add(topic.trim());
                }
            }
        }
        return topics;
    }

    private static List<String> segments(String relativePath) {
        List<String> segments = new ArrayList<>();
        for (String part : relativePath.split("/")) {
            if (!part.isBlank()) {
                segments.add(part);
            }
        }
        return segments;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (Exception e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}
