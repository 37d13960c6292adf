package com.mk.fx.qa.httpload.http;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequestExecutorTest {

    private HttpServer server;
    private ExecutorService serverExecutor;
    private String baseUrl;
    private TransportPool pool;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastUserAgent = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();
    private final AtomicReference<String> lastMethod = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/ok", exchange -> respond(exchange, 200, "OK"));
        server.createContext("/created", exchange -> respond(exchange, 201, "{\"id\":1}"));
        server.createContext("/missing", exchange -> respond(exchange, 404, "NOPE"));
        server.createContext("/err", exchange -> respond(exchange, 500, "ERR"));
        server.createContext("/trickle", RequestExecutorTest::trickle);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        pool = TransportPool.create(TransportSettings.defaults(), 1.0);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
        if (server != null) {
            server.stop(0);
        }
        if (serverExecutor != null) {
            serverExecutor.shutdownNow();
        }
    }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        lastMethod.set(exchange.getRequestMethod());
        lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
        lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
        lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /** Sends the head at once, then one body byte every 200 ms for about 3 s. */
    private static void trickle(HttpExchange exchange) throws IOException {
        exchange.getRequestBody().readAllBytes();
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream os = exchange.getResponseBody()) {
            for (int i = 0; i < 16; i++) {
                os.write('x');
                os.flush();
                Thread.sleep(200);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException clientWentAway) {
            exchange.close();
        }
    }

    private ExchangeResult execute(RequestExecutor executor, String url, String body, String method) {
        return executor.execute(
                pool.client(TransportKind.KEEP_ALIVE), pool.deadline(), new RequestSpec(url, body), method);
    }

    @Test
    void successfulExchange_isClassifiedAsSuccess_withStatusAndLatency() {
        var result = execute(new RequestExecutor(), baseUrl + "/ok", "{\"a\":1}", "POST");

        assertTrue(result.success());
        assertTrue(result.responded());
        assertEquals(200, result.statusCode());
        assertFalse(result.latency().isNegative());
        assertTrue(result.latency().compareTo(Duration.ofSeconds(10)) < 0);
    }

    @Test
    void anyTwoHundredStatus_isSuccess() {
        var result = execute(new RequestExecutor(), baseUrl + "/created", "", "POST");

        assertTrue(result.success());
        assertEquals(201, result.statusCode());
    }

    @Test
    void nonSuccessStatus_isFailure_butKeepsStatusCode() {
        var notFound = execute(new RequestExecutor(), baseUrl + "/missing", "", "GET");
        var serverError = execute(new RequestExecutor(), baseUrl + "/err", "", "GET");

        assertFalse(notFound.success());
        assertTrue(notFound.responded());
        assertEquals(404, notFound.statusCode());
        assertFalse(serverError.success());
        assertEquals(500, serverError.statusCode());
    }

    @Test
    void sendsFixedHeaders_methodAndBody() {
        execute(new RequestExecutor("custom-agent/1.0"), baseUrl + "/ok", "{\"name\":\"x\"}", "PUT");

        assertEquals("PUT", lastMethod.get());
        assertEquals("custom-agent/1.0", lastUserAgent.get());
        assertNotNull(lastContentType.get());
        assertTrue(lastContentType.get().startsWith("application/json"));
        assertEquals("{\"name\":\"x\"}", lastBody.get());
    }

    @Test
    void blankUserAgent_fallsBackToDefault() {
        execute(new RequestExecutor("  "), baseUrl + "/ok", "", "POST");

        assertEquals(RequestExecutor.DEFAULT_USER_AGENT, lastUserAgent.get());
    }

    @Test
    void unreachableTarget_isNoResponse() {
        var result = execute(new RequestExecutor(), "http://127.0.0.1:1/ok", "", "POST");

        assertEquals(ExchangeResult.noResponse(), result);
        assertFalse(result.success());
        assertEquals(0, result.statusCode());
        assertEquals(Duration.ZERO, result.latency());
    }

    @Test
    void tricklingResponse_isCutOffAtTheRequestTimeout() {
        var settings = new TransportSettings(Duration.ofSeconds(1), 10, Duration.ofSeconds(30));
        try (var shortPool = TransportPool.create(settings, 0.5)) {
            for (TransportKind kind : TransportKind.values()) {
                var startedAt = System.nanoTime();
                var result = new RequestExecutor().execute(
                        shortPool.client(kind),
                        shortPool.deadline(),
                        new RequestSpec(baseUrl + "/trickle", ""),
                        "GET");
                var wall = Duration.ofNanos(System.nanoTime() - startedAt);

                assertEquals(ExchangeResult.noResponse(), result, kind.name());
                assertTrue(wall.compareTo(Duration.ofMillis(2_500)) < 0, kind + " took " + wall);
            }
        }
    }

    @Test
    void invalidMethod_isNoResponse_withoutThrowing() {
        var result = execute(new RequestExecutor(), baseUrl + "/ok", "", "GE T");

        assertFalse(result.responded());
        assertEquals(0, result.statusCode());
    }

    @Test
    void malformedOrRelativeUrl_isNoResponse_withoutThrowing() {
        var executor = new RequestExecutor();

        assertFalse(execute(executor, "http://bad host/", "", "GET").responded());
        assertFalse(execute(executor, "/relative/path", "", "GET").responded());
    }

    @Test
    void buildRequest_rejectsInvalidInput() {
        var executor = new RequestExecutor();

        assertThrows(
                IllegalArgumentException.class,
                () -> executor.buildRequest(new RequestSpec(baseUrl, ""), null));
        assertThrows(
                IllegalArgumentException.class,
                () -> executor.buildRequest(new RequestSpec("nohost", ""), "GET"));
        assertEquals("DELETE", executor.buildRequest(new RequestSpec(baseUrl + "/ok", ""), "DELETE").getMethod());
    }

    @Test
    void measure_runsFromFirstByteToDrainCompletion() {
        assertEquals(Duration.ofNanos(300), RequestExecutor.measure(1_700, 2_000));
        assertEquals(Duration.ZERO, RequestExecutor.measure(2_000, 1_000));
    }
}
