package ai.repld.daemon.http;

import ai.repld.repl.AllocationExhaustedException;
import ai.repld.repl.CallResult;
import ai.repld.repl.MessageLocation;
import ai.repld.repl.ReplCheckResult;
import ai.repld.repl.ReplCodeLine;
import ai.repld.repl.ReplCompileResult;
import ai.repld.repl.ReplService;
import com.google.common.base.Splitter;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * HTTP front end of {@link ReplService}. Session handles are exported as integer ids; a {@code DELETE} is the
 * client's signal that it dropped its handle.
 */
public final class ReplHttpServer {
    private static final Logger logger = LogManager.getLogger(ReplHttpServer.class);
    private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();
    private static final int PROTOCOL_VERSION = 1;

    private final UUID daemonId;
    private final ReplService service;
    private final SimpleHttpServer server;
    private final AtomicInteger lineCounter = new AtomicInteger();

    public ReplHttpServer(UUID daemonId, ReplService service, String host, int port, int threadCount)
            throws IOException {
        this.daemonId = daemonId;
        this.service = service;
        this.server = new SimpleHttpServer(host, port, threadCount);

        server.registerContext("/health/live", this::handleHealthLive);
        server.registerContext("/health/ready", this::handleHealthReady);
        server.registerContext("/v1", this::handleV1Router);
    }

    public void start() {
        server.start();
    }

    public void stop(int delaySeconds) {
        server.stop(delaySeconds);
    }

    public int getPort() {
        return server.getPort();
    }

    private void handleHealthLive(HttpExchange exchange) throws IOException {
        if (!exchange.getRequestMethod().equals("GET")) {
            methodNotAllowed(exchange);
            return;
        }
        var response = Map.of(
                "daemonId", daemonId.toString(),
                "protocolVersion", PROTOCOL_VERSION,
                "sessions", service.getStates().size());
        SimpleHttpServer.sendJsonResponse(exchange, response);
    }

    private void handleHealthReady(HttpExchange exchange) throws IOException {
        if (!exchange.getRequestMethod().equals("GET")) {
            methodNotAllowed(exchange);
            return;
        }
        if (!service.isInitialized()) {
            var error = ErrorPayload.of(ErrorPayload.Code.INITIALIZATION_ERROR, "REPL compiler is not available");
            SimpleHttpServer.sendJsonResponse(exchange, 503, error);
            return;
        }
        SimpleHttpServer.sendJsonResponse(exchange, Map.of("status", "ready"));
    }

    private void handleV1Router(HttpExchange exchange) throws IOException {
        var segments = PATH_SPLITTER.splitToList(exchange.getRequestURI().getPath());
        var method = exchange.getRequestMethod();

        if (segments.size() < 2 || !segments.get(1).equals("sessions")) {
            notFound(exchange);
            return;
        }

        if (segments.size() == 2) {
            if (method.equals("POST")) {
                handleCreateSession(exchange);
            } else {
                methodNotAllowed(exchange);
            }
            return;
        }

        Integer sessionId = parseSessionId(segments.get(2));
        if (sessionId == null) {
            var error = ErrorPayload.validationError("Invalid session id: " + segments.get(2));
            SimpleHttpServer.sendJsonResponse(exchange, 400, error);
            return;
        }

        if (segments.size() == 3) {
            if (method.equals("DELETE")) {
                handleReleaseSession(exchange, sessionId);
            } else {
                methodNotAllowed(exchange);
            }
            return;
        }

        if (segments.size() == 4 && (segments.get(3).equals("check") || segments.get(3).equals("compile"))) {
            if (!method.equals("POST")) {
                methodNotAllowed(exchange);
                return;
            }
            if (segments.get(3).equals("check")) {
                handleCheck(exchange, sessionId);
            } else {
                handleCompile(exchange, sessionId);
            }
            return;
        }

        notFound(exchange);
    }

    private void handleCreateSession(HttpExchange exchange) throws IOException {
        CreateSessionRequest request;
        try {
            request = SimpleHttpServer.parseJsonRequest(exchange, CreateSessionRequest.class);
        } catch (IOException e) {
            logger.warn("Invalid JSON in POST /v1/sessions", e);
            SimpleHttpServer.sendJsonResponse(exchange, 400, ErrorPayload.validationError("Invalid JSON request body"));
            return;
        }

        if (!service.isInitialized()) {
            var error = ErrorPayload.of(ErrorPayload.Code.INITIALIZATION_ERROR, "REPL compiler is not available");
            SimpleHttpServer.sendJsonResponse(exchange, 503, error);
            return;
        }

        try {
            var facade = request == null || request.port() == null
                    ? service.createRemoteState()
                    : service.createRemoteState(request.port());
            SimpleHttpServer.sendJsonResponse(exchange, 201, Map.of("sessionId", facade.getId()));
        } catch (AllocationExhaustedException e) {
            logger.error("Session id allocation failed", e);
            SimpleHttpServer.sendJsonResponse(exchange, 500, ErrorPayload.internalError("Failed to allocate id", e));
        }
    }

    private void handleReleaseSession(HttpExchange exchange, int sessionId) throws IOException {
        if (service.releaseRemoteState(sessionId)) {
            exchange.sendResponseHeaders(204, -1);
        } else {
            SimpleHttpServer.sendJsonResponse(exchange, 404, ErrorPayload.sessionNotFound(noStateMessage(sessionId)));
        }
    }

    private void handleCheck(HttpExchange exchange, int sessionId) throws IOException {
        var line = readCodeLine(exchange);
        if (line == null) {
            return;
        }
        var result = service.check(sessionId, line);
        if (!(result instanceof CallResult.Good<ReplCheckResult> good)) {
            sendCallError(exchange, result);
            return;
        }
        var body = new LinkedHashMap<String, Object>();
        var checkResult = good.result();
        if (checkResult instanceof ReplCheckResult.Ok) {
            body.put("status", "OK");
        } else if (checkResult instanceof ReplCheckResult.Incomplete) {
            body.put("status", "INCOMPLETE");
        } else if (checkResult instanceof ReplCheckResult.Error error) {
            putError(body, error.message(), error.location());
        }
        SimpleHttpServer.sendJsonResponse(exchange, body);
    }

    private void handleCompile(HttpExchange exchange, int sessionId) throws IOException {
        var line = readCodeLine(exchange);
        if (line == null) {
            return;
        }
        var result = service.compile(sessionId, line);
        if (!(result instanceof CallResult.Good<ReplCompileResult> good)) {
            sendCallError(exchange, result);
            return;
        }
        var body = new LinkedHashMap<String, Object>();
        var compileResult = good.result();
        if (compileResult instanceof ReplCompileResult.CompiledClasses compiled) {
            body.put("status", "OK");
            body.put("generation", compiled.generation());
            body.put("artifact", compiled.artifact());
        } else if (compileResult instanceof ReplCompileResult.Incomplete) {
            body.put("status", "INCOMPLETE");
        } else if (compileResult instanceof ReplCompileResult.Error error) {
            putError(body, error.message(), error.location());
        }
        SimpleHttpServer.sendJsonResponse(exchange, body);
    }

    @Nullable
    private ReplCodeLine readCodeLine(HttpExchange exchange) throws IOException {
        CodeLineRequest request;
        try {
            request = SimpleHttpServer.parseJsonRequest(exchange, CodeLineRequest.class);
        } catch (IOException e) {
            logger.debug("Invalid code line request: {}", e.getMessage());
            SimpleHttpServer.sendJsonResponse(exchange, 400, ErrorPayload.validationError("Invalid JSON request body"));
            return null;
        }
        if (request == null || request.code() == null) {
            SimpleHttpServer.sendJsonResponse(exchange, 400, ErrorPayload.validationError("code is required"));
            return null;
        }
        int no = request.lineNo() == null ? lineCounter.incrementAndGet() : request.lineNo();
        int generation = request.generation() == null ? ReplCodeLine.NO_GENERATION : request.generation();
        return new ReplCodeLine(no, generation, request.code());
    }

    private static void putError(Map<String, Object> body, String message, @Nullable MessageLocation location) {
        body.put("status", "ERROR");
        body.put("message", message);
        if (location != null) {
            body.put("location", location);
        }
    }

    private static void sendCallError(HttpExchange exchange, CallResult<?> result) throws IOException {
        var message = result instanceof CallResult.Error<?> error ? error.message() : "Unknown error";
        SimpleHttpServer.sendJsonResponse(exchange, 404, ErrorPayload.sessionNotFound(message));
    }

    @Nullable
    private static Integer parseSessionId(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String noStateMessage(int sessionId) {
        return "No REPL state with id " + sessionId + " found";
    }

    private static void methodNotAllowed(HttpExchange exchange) throws IOException {
        var error = ErrorPayload.of(ErrorPayload.Code.METHOD_NOT_ALLOWED, "Method not allowed");
        SimpleHttpServer.sendJsonResponse(exchange, 405, error);
    }

    private static void notFound(HttpExchange exchange) throws IOException {
        SimpleHttpServer.sendJsonResponse(exchange, 404, ErrorPayload.of(ErrorPayload.Code.NOT_FOUND, "Not found"));
    }

    private record CreateSessionRequest(@Nullable Integer port) {}

    private record CodeLineRequest(
            @Nullable String code, @Nullable Integer lineNo, @Nullable Integer generation) {}
}
