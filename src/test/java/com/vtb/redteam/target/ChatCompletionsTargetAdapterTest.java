package com.vtb.redteam.target;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ChatCompletionsTargetAdapterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<JsonNode> lastRequest = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            JsonNode request = mapper.readTree(exchange.getRequestBody());
            lastRequest.set(request);
            JsonNode messages = request.get("messages");
            String userText = messages.get(messages.size() - 1).get("content").asText();
            String body = mapper.createObjectNode()
                .set("choices", mapper.createArrayNode().add(mapper.createObjectNode()
                    .set("message", mapper.createObjectNode()
                        .put("role", "assistant")
                        .put("content", "echo: " + userText))))
                .toString();
            respond(exchange, 200, body);
        });
        server.createContext("/error", exchange -> respond(exchange, 500, "{\"error\":\"overloaded\"}"));
        server.createContext("/html", exchange -> respond(exchange, 200, "<html>maintenance</html>"));
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "{\"choices\":[{\"text\":\"late\"}]}");
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void sendsSystemAndUserMessages() throws Exception {
        ChatCompletionsTargetAdapter adapter =
            new ChatCompletionsTargetAdapter(baseUrl + "/v1/chat/completions", "test-model", "secret");

        TargetResponse response = adapter.invoke("You are a bank assistant.", "Hello", Duration.ofSeconds(5));

        assertEquals("echo: Hello", response.responseText());
        assertTrue(response.elapsedMs() >= 0);
        assertEquals("Bearer secret", lastAuthorization.get());

        JsonNode request = lastRequest.get();
        assertEquals("test-model", request.get("model").asText());
        assertEquals("system", request.get("messages").get(0).get("role").asText());
        assertEquals("You are a bank assistant.", request.get("messages").get(0).get("content").asText());
        assertEquals("user", request.get("messages").get(1).get("role").asText());
    }

    @Test
    void blankContextSendsOnlyUserMessage() throws Exception {
        ChatCompletionsTargetAdapter adapter =
            new ChatCompletionsTargetAdapter(baseUrl + "/v1/chat/completions", null, null);
        adapter.invoke("", "Hi", Duration.ofSeconds(5));
        assertEquals(1, lastRequest.get().get("messages").size());
        assertNull(lastAuthorization.get());
    }

    @Test
    void serverErrorIsTransportFailure() {
        ChatCompletionsTargetAdapter adapter = new ChatCompletionsTargetAdapter(baseUrl + "/error", "m", null);
        TargetTransportException e = assertThrows(TargetTransportException.class,
            () -> adapter.invoke("ctx", "Hello", Duration.ofSeconds(5)));
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    void nonJsonBodyIsTransportFailure() {
        ChatCompletionsTargetAdapter adapter = new ChatCompletionsTargetAdapter(baseUrl + "/html", "m", null);
        assertThrows(TargetTransportException.class, () -> adapter.invoke("ctx", "Hello", Duration.ofSeconds(5)));
    }

    @Test
    void slowServerTimesOut() {
        ChatCompletionsTargetAdapter adapter = new ChatCompletionsTargetAdapter(baseUrl + "/slow", "m", null);
        assertThrows(TargetTimeoutException.class, () -> adapter.invoke("ctx", "Hello", Duration.ofMillis(300)));
    }

    @Test
    void completionStyleTextIsAccepted() throws Exception {
        ChatCompletionsTargetAdapter adapter = new ChatCompletionsTargetAdapter(baseUrl + "/slow", "m", null);
        assertEquals("plain", adapter.extractContent("{\"choices\":[{\"text\":\"plain\"}]}"));
        assertThrows(TargetTransportException.class, () -> adapter.extractContent("{\"choices\":[]}"));
    }

    @Test
    void invalidEndpointIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChatCompletionsTargetAdapter("not a url", "m", null));
    }
}
