package ai.repld.daemon.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Lightweight wrapper around the JDK HttpServer with JSON request/response helpers. */
public final class SimpleHttpServer {
    private static final Logger logger = LogManager.getLogger(SimpleHttpServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final AtomicInteger workerThreadCounter = new AtomicInteger(0);

    private final HttpServer httpServer;
    private final ExecutorService executor;

    /**
     * Create a new SimpleHttpServer.
     *
     * @param host        The hostname or IP address to bind to (e.g., "localhost", "127.0.0.1")
     * @param port        The port to bind to; 0 picks a free port
     * @param threadCount Number of worker threads in the thread pool
     * @throws IOException If the server cannot be created
     */
    public SimpleHttpServer(String host, int port, int threadCount) throws IOException {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be at least 1, got: " + threadCount);
        }
        this.httpServer = HttpServer.create(new InetSocketAddress(host, port), 0);

        this.executor = Executors.newFixedThreadPool(threadCount, r -> {
            var t = new Thread(r, "SimpleHttpServer-Worker-" + workerThreadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.httpServer.setExecutor(executor);

        logger.info("SimpleHttpServer created: {}:{} with {} worker threads", host, port, threadCount);
    }

    /**
     * Register an endpoint. Exceptions escaping the handler are logged and answered with a 500.
     *
     * @param path    The URI path (e.g., "/health/live")
     * @param handler The handler to invoke
     */
    public void registerContext(String path, CheckedHttpHandler handler) {
        this.httpServer.createContext(path, exchange -> {
            try {
                handler.handle(exchange);
            } catch (Exception e) {
                logger.error("Unhandled exception in handler for {}", path, e);
                sendJsonResponse(exchange, 500, ErrorPayload.internalError("Internal server error", e));
            } finally {
                exchange.close();
            }
        });
        logger.debug("Registered context: {}", path);
    }

    /**
     * Parse JSON from the request body.
     *
     * @param exchange  The HTTP exchange
     * @param valueType The class to deserialize into
     * @param <T>       The type parameter
     * @return The deserialized object, or null if the body is empty
     * @throws IOException If the body cannot be read or is not valid JSON for {@code valueType}
     */
    public static <T> @Nullable T parseJsonRequest(HttpExchange exchange, Class<T> valueType) throws IOException {
        byte[] body;
        try (InputStream is = exchange.getRequestBody()) {
            body = is.readAllBytes();
        }
        if (new String(body, StandardCharsets.UTF_8).isBlank()) {
            return null;
        }
        return objectMapper.readValue(body, valueType);
    }

    /**
     * Send a JSON response with status 200 OK.
     *
     * @param exchange       The HTTP exchange
     * @param responseObject The object to serialize as JSON
     * @throws IOException If writing to the exchange fails
     */
    public static void sendJsonResponse(HttpExchange exchange, Object responseObject) throws IOException {
        sendJsonResponse(exchange, 200, responseObject);
    }

    /**
     * Send a JSON response with the specified status code.
     *
     * @param exchange       The HTTP exchange
     * @param statusCode     The HTTP status code (e.g., 200, 404, 500)
     * @param responseObject The object to serialize as JSON
     * @throws IOException If writing to the exchange fails
     */
    public static void sendJsonResponse(HttpExchange exchange, int statusCode, Object responseObject)
            throws IOException {
        var headers = exchange.getResponseHeaders();
        headers.set("Content-Type", "application/json; charset=UTF-8");

        var jsonBytes = objectMapper.writeValueAsBytes(responseObject);
        exchange.sendResponseHeaders(statusCode, jsonBytes.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(jsonBytes);
        }
        exchange.close();
    }

    /** Start the HTTP server. */
    public void start() {
        this.httpServer.start();
        logger.info("SimpleHttpServer started on {}", httpServer.getAddress());
    }

    /**
     * Stop the HTTP server gracefully.
     *
     * @param delaySeconds The number of seconds to wait for current exchanges to complete
     */
    public void stop(int delaySeconds) {
        this.httpServer.stop(delaySeconds);
        executor.shutdownNow();
        logger.info("SimpleHttpServer stopped");
    }

    /**
     * Return the actual port the server is bound to.
     *
     * @return the listening port number
     */
    public int getPort() {
        return this.httpServer.getAddress().getPort();
    }

    /** Functional interface for HTTP handlers that may throw exceptions. */
    @FunctionalInterface
    public interface CheckedHttpHandler {
        void handle(HttpExchange exchange) throws Exception;
    }
}
