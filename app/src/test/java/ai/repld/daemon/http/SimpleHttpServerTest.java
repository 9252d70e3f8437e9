package ai.repld.daemon.http;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleHttpServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private SimpleHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new SimpleHttpServer("127.0.0.1", 0, 1);
        server.registerContext("/ok", exchange -> SimpleHttpServer.sendJsonResponse(exchange, Map.of("a", 1)));
        server.registerContext("/fail", exchange -> {
            throw new IllegalStateException("boom");
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private HttpResponse<String> get(String path) throws Exception {
        var request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testJsonResponse() throws Exception {
        var response = get("/ok");
        assertEquals(200, response.statusCode());
        assertEquals("application/json; charset=UTF-8", response.headers().firstValue("Content-Type").orElseThrow());
        assertEquals(1, new ObjectMapper().readTree(response.body()).get("a").asInt());
    }

    @Test
    void testHandlerExceptionBecomesInternalError() throws Exception {
        var response = get("/fail");
        assertEquals(500, response.statusCode());
        var body = new ObjectMapper().readTree(response.body());
        assertEquals(ErrorPayload.Code.INTERNAL_ERROR, body.get("code").asText());
        assertEquals("IllegalStateException: boom", body.get("details").asText());
    }

    @Test
    void testErrorPayloadRejectsBlankFields() {
        assertThrows(IllegalArgumentException.class, () -> ErrorPayload.of(" ", "message"));
        assertThrows(IllegalArgumentException.class, () -> ErrorPayload.validationError(""));
        assertNull(ErrorPayload.sessionNotFound("gone").details());
    }
}
