package de.entwicklertraining.api.resilient;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.entwicklertraining.api.resilient.concurrency.ConcurrencyGate;
import de.entwicklertraining.api.resilient.json.ResponseDecoders;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client with the JDK transport against a local {@link HttpServer}.
 */
public class ApiClientIntegrationTest {

    private static final long SLOW_HANDLER_MS = 300;

    static HttpServer server;
    static ExecutorService serverExecutor;
    static String baseUrl;

    static final AtomicInteger flakyCalls = new AtomicInteger();
    static final AtomicInteger inFlight = new AtomicInteger();
    static final AtomicInteger maxInFlight = new AtomicInteger();

    @BeforeAll
    static void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        server.createContext("/quote", ex -> respond(ex, 200, "{\"symbol\":\"AAPL\",\"last\":189.5,\"tags\":[\"us\",\"tech\"]}"));

        server.createContext("/echo", ex -> {
            String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            JSONObject echo = new JSONObject()
                    .put("method", ex.getRequestMethod())
                    .put("body", body)
                    .put("contentType", String.valueOf(ex.getRequestHeaders().getFirst("Content-Type")))
                    .put("client", String.valueOf(ex.getRequestHeaders().getFirst("X-Client")))
                    .put("auth", String.valueOf(ex.getRequestHeaders().getFirst("Authorization")))
                    .put("requestId", String.valueOf(ex.getRequestHeaders().getFirst("X-Request-ID")))
                    .put("query", String.valueOf(ex.getRequestURI().getQuery()));
            respond(ex, 200, echo.toString());
        });

        server.createContext("/flaky", ex -> {
            if (flakyCalls.incrementAndGet() == 1) {
                ex.getResponseHeaders().add("Retry-After", "1");
                respond(ex, 503, "{\"error\":\"warming up\"}");
            } else {
                respond(ex, 200, "{\"ready\":true}");
            }
        });

        server.createContext("/slow", ex -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                Thread.sleep(SLOW_HANDLER_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            respond(ex, 200, "{}");
        });

        server.createContext("/hang", ex -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "{}");
        });

        server.createContext("/broken", ex -> respond(ex, 200, "{\"truncated\":"));

        server.start();
    }

    @AfterAll
    static void stopServer() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @BeforeEach
    void resetCounters() {
        flakyCalls.set(0);
        inFlight.set(0);
        maxInFlight.set(0);
    }

    private static void respond(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        if ("HEAD".equalsIgnoreCase(ex.getRequestMethod()) || bytes.length == 0) {
            ex.sendResponseHeaders(status, -1);
            ex.close();
            return;
        }
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static ApiClientSettings.Builder fast() {
        return ApiClientSettings.builder().timeout(Duration.ofSeconds(5)).deterministic(true);
    }

    @Test
    void testGetDecodesJson() {
        ApiClient client = new ApiClient(fast().build());

        ApiResponse<JSONObject> response = client.get(baseUrl + "/quote", ResponseDecoders.jsonObject());

        assertTrue(response.isSuccess());
        assertEquals(200, response.getStatus());
        JSONObject expected = new JSONObject().put("symbol", "AAPL").put("last", 189.5)
                .put("tags", List.of("us", "tech"));
        assertTrue(expected.similar(response.getData().orElseThrow()));
        assertEquals("application/json", response.getHeaders().firstValue("content-type").orElseThrow());
    }

    @Test
    void testPostSendsJsonBodyAndHeaders() {
        ApiHttpConfiguration httpConfig = ApiHttpConfiguration.builder()
                .bearerToken("secret")
                .requestModifier(builder -> builder.header("X-Request-ID", "req-1"))
                .build();
        ApiClient client = new ApiClient(fast().build(), httpConfig);

        ApiResponse<JSONObject> response = client.post(baseUrl + "/echo?dry=true", Map.of("X-Client", "adapter"),
                Map.of("symbol", "AAPL"), ResponseDecoders.jsonObject());

        JSONObject echo = response.getData().orElseThrow();
        assertEquals("POST", echo.getString("method"));
        assertTrue(new JSONObject(echo.getString("body")).similar(new JSONObject().put("symbol", "AAPL")));
        assertEquals("application/json", echo.getString("contentType"));
        assertEquals("adapter", echo.getString("client"));
        assertEquals("Bearer secret", echo.getString("auth"));
        assertEquals("req-1", echo.getString("requestId"));
        assertEquals("dry=true", echo.getString("query"));
    }

    @Test
    void testOtherMethodsReachServer() {
        ApiClient client = new ApiClient(fast().build());

        ApiResponse<JSONObject> delete = client.delete(baseUrl + "/echo", Map.of(), ResponseDecoders.jsonObject());
        ApiResponse<JSONObject> options = client.options(baseUrl + "/echo", Map.of(), ResponseDecoders.jsonObject());
        ApiResponse<JSONObject> patch = client.patch(baseUrl + "/echo", Map.of(), List.of(1), ResponseDecoders.jsonObject());
        ApiResponse<Void> head = client.head(baseUrl + "/quote", Map.of());

        assertEquals("DELETE", delete.getData().orElseThrow().getString("method"));
        assertEquals("", delete.getData().orElseThrow().getString("body"));
        assertEquals("OPTIONS", options.getData().orElseThrow().getString("method"));
        assertEquals("[1]", patch.getData().orElseThrow().getString("body"));
        assertTrue(head.isSuccess());
        assertTrue(head.getData().isEmpty());
    }

    @Test
    void testUnknownPathIsUnsuccessfulResponse() {
        ApiClient client = new ApiClient(fast().build());

        ApiResponse<JSONObject> response = client.get(baseUrl + "/missing", ResponseDecoders.jsonObject());

        assertFalse(response.isSuccess());
        assertEquals(404, response.getStatus());
        assertTrue(response.getErrorBody().isPresent());
    }

    @Test
    @Timeout(10)
    @DisplayName("Numeric Retry-After from the server is honored before retrying")
    void testRetryAfterIsHonored() {
        ApiClient client = new ApiClient(fast().build());

        long started = System.nanoTime();
        ApiResponse<JSONObject> response = client.get(baseUrl + "/flaky", ResponseDecoders.jsonObject());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(response.isSuccess());
        assertEquals(2, flakyCalls.get());
        assertTrue(elapsedMs >= 1000, "retried after " + elapsedMs + "ms");
    }

    @Test
    @Timeout(10)
    void testConcurrencyLimitSerializesRequests() throws Exception {
        ApiClient client = new ApiClient(fast().concurrencyLimit(1).build());
        ApiRequest request = ApiRequest.builder(HttpMethod.GET, baseUrl + "/slow").build();

        long started = System.nanoTime();
        CompletableFuture<ApiResponse<JSONObject>> first = client.executeAsync(request, ResponseDecoders.jsonObject());
        CompletableFuture<ApiResponse<JSONObject>> second = client.executeAsync(request, ResponseDecoders.jsonObject());
        CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(first.get().isSuccess());
        assertTrue(second.get().isSuccess());
        assertEquals(1, maxInFlight.get());
        assertTrue(elapsedMs >= 2 * SLOW_HANDLER_MS, "both requests done after " + elapsedMs + "ms");
    }

    @Test
    @Timeout(10)
    void testSharedGateBoundsSeveralClients() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        ApiClient quotes = new ApiClient(fast().concurrencyLimit(4).sharedGate(gate).build());
        ApiClient orders = new ApiClient(fast().concurrencyLimit(4).sharedGate(gate).build());
        ApiRequest request = ApiRequest.builder(HttpMethod.GET, baseUrl + "/slow").build();

        CompletableFuture<ApiResponse<JSONObject>> first = quotes.executeAsync(request, ResponseDecoders.jsonObject());
        CompletableFuture<ApiResponse<JSONObject>> second = orders.executeAsync(request, ResponseDecoders.jsonObject());
        CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);

        assertEquals(1, maxInFlight.get());
        assertSame(gate, quotes.getConcurrencyGate());
        assertEquals(1, gate.availablePermits());
    }

    @Test
    @Timeout(10)
    void testAttemptTimeoutIsReported() {
        ApiClient client = new ApiClient(fast().timeout(Duration.ofMillis(200)).build());

        ApiClient.ApiTimeoutException e = assertThrows(ApiClient.ApiTimeoutException.class,
                () -> client.get(baseUrl + "/hang", ResponseDecoders.jsonObject()));

        assertNotNull(e.getCause());
        assertEquals(2, client.getConcurrencyGate().availablePermits());
    }

    @Test
    void testUndecodableSuccessBody() {
        ApiClient client = new ApiClient(fast().build());

        assertThrows(ApiClient.ApiResponseUnusableException.class,
                () -> client.get(baseUrl + "/broken", ResponseDecoders.jsonObject()));
    }

    @Test
    void testRestrictedHeaderFailsInsideClient() {
        ApiClient client = new ApiClient(fast().build());

        assertThrows(ApiClient.InternalException.class,
                () -> client.get(baseUrl + "/quote", Map.of("Host", "elsewhere"), ResponseDecoders.jsonObject()));
        assertEquals(2, client.getConcurrencyGate().availablePermits());
    }

    @Test
    @Timeout(5)
    void testRefusedConnectionExhaustsRetries() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = socket.getLocalPort();
        }
        ApiClient client = new ApiClient(fast().retryCount(1).build());

        ApiClient.RetriesExhaustedException e = assertThrows(ApiClient.RetriesExhaustedException.class,
                () -> client.get("http://127.0.0.1:" + closedPort + "/", ResponseDecoders.jsonObject()));

        assertEquals(2, e.getAttempts());
        assertTrue(e.getMessage().contains("attempts=2"));
        assertTrue(e.getMessage().contains("last_err="));
    }
}
