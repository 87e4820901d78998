package com.vtb.redteam.target;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Адаптер для OpenAI-совместимых эндпоинтов /chat/completions.
 *
 * Системный контекст уходит сообщением role=system, нагрузка атаки сообщением
 * role=user. Таймаут вызова задается на каждый запрос.
 */
@Slf4j
public class ChatCompletionsTargetAdapter implements TargetAdapter {

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int ERROR_BODY_LIMIT = 300;

    private final HttpUrl endpoint;
    private final String model;
    private final String apiKey;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ChatCompletionsTargetAdapter(String endpoint, String model, String apiKey) {
        this(endpoint, model, apiKey, new OkHttpClient.Builder()
            .followRedirects(false)
            .retryOnConnectionFailure(false)
            .build());
    }

    ChatCompletionsTargetAdapter(String endpoint, String model, String apiKey, OkHttpClient httpClient) {
        HttpUrl parsed = endpoint != null ? HttpUrl.parse(endpoint.trim()) : null;
        if (parsed == null) {
            throw new IllegalArgumentException("Неверный URL эндпоинта: " + endpoint);
        }
        this.endpoint = parsed;
        this.model = model;
        this.apiKey = apiKey;
        this.httpClient = httpClient;
    }

    @Override
    public TargetResponse invoke(String targetContext, String payload, Duration timeout)
        throws TargetTimeoutException, TargetTransportException {
        long timeoutMs = timeout != null ? Math.max(1L, timeout.toMillis()) : 30_000L;
        OkHttpClient client = httpClient.newBuilder()
            .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .build();

        Request.Builder requestBuilder = new Request.Builder()
            .url(endpoint)
            .addHeader("User-Agent", "VTB-LLM-RedTeam/1.0")
            .post(RequestBody.create(buildRequestBody(targetContext, payload), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.addHeader("Authorization", "Bearer " + apiKey);
        }

        long start = System.nanoTime();
        try (Response response = client.newCall(requestBuilder.build()).execute()) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new TargetTransportException("Цель вернула HTTP " + response.code()
                    + ": " + truncate(raw, ERROR_BODY_LIMIT));
            }
            return new TargetResponse(extractContent(raw), elapsedMs);
        } catch (SocketTimeoutException timeoutException) {
            throw new TargetTimeoutException("Таймаут вызова цели (" + timeoutMs + " мс)", timeoutException);
        } catch (InterruptedIOException interrupted) {
            // callTimeout в OkHttp приходит как InterruptedIOException("timeout")
            if ("timeout".equalsIgnoreCase(interrupted.getMessage())) {
                throw new TargetTimeoutException("Таймаут вызова цели (" + timeoutMs + " мс)", interrupted);
            }
            throw new TargetTransportException("Вызов цели прерван: " + interrupted.getMessage(), interrupted);
        } catch (IOException ioe) {
            throw new TargetTransportException("Ошибка транспорта: " + ioe.getMessage(), ioe);
        }
    }

    @Override
    public String name() {
        return "chat-completions(" + endpoint.host() + ")";
    }

    String buildRequestBody(String targetContext, String payload) throws TargetTransportException {
        ObjectNode root = objectMapper.createObjectNode();
        if (model != null && !model.isBlank()) {
            root.put("model", model);
        }
        ArrayNode messages = root.putArray("messages");
        if (targetContext != null && !targetContext.isBlank()) {
            messages.addObject().put("role", "system").put("content", targetContext);
        }
        messages.addObject().put("role", "user").put("content", payload != null ? payload : "");
        try {
            return objectMapper.writeValueAsString(root);
        } catch (IOException e) {
            throw new TargetTransportException("Не удалось сериализовать запрос: " + e.getMessage(), e);
        }
    }

    String extractContent(String raw) throws TargetTransportException {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (IOException e) {
            throw new TargetTransportException("Ответ цели не является JSON: " + truncate(raw, ERROR_BODY_LIMIT), e);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new TargetTransportException("В ответе цели нет choices");
        }
        JsonNode first = choices.get(0);
        JsonNode content = first.path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            // completions-стиль ответа
            content = first.path("text");
        }
        return content.isMissingNode() || content.isNull() ? "" : content.asText();
    }

    private String truncate(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        return text.substring(0, Math.max(0, limit)) + "...";
    }
}
