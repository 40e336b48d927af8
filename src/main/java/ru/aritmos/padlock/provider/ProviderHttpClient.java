package ru.aritmos.padlock.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.padlock.core.SensitiveDataSanitizer;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Минимальный HTTP-клиент для token/userinfo endpoints провайдеров.
 * <p>
 * Каждый вызов ограничен собственным таймаутом, ретраев нет. Транспортные ошибки
 * превращаются в {@link ProviderExchangeException}; вызов никогда не «висит» бесконечно.
 * Важно: токены передаются только в рамках конкретного сетевого вызова и не логируются.
 */
@Singleton
public class ProviderHttpClient {

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    @Inject
    public ProviderHttpClient(ObjectMapper objectMapper) {
        this(objectMapper, Duration.ofSeconds(3), Duration.ofSeconds(10));
    }

    public ProviderHttpClient(ObjectMapper objectMapper, Duration connectTimeout, Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        this.requestTimeout = requestTimeout;
    }

    /**
     * Ответ с JSON-телом. Если тело не является JSON, {@code body}: {@link MissingNode}.
     */
    public record JsonResponse(int status, JsonNode body) {

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }

    public record BinaryResponse(int status, String contentType, byte[] body) {

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }

    /**
     * POST application/x-www-form-urlencoded.
     */
    public JsonResponse postForm(String providerId, String url, Map<String, String> form, Map<String, String> headers) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form), StandardCharsets.UTF_8));
        applyHeaders(b, headers);
        HttpResponse<String> resp = send(providerId, b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new JsonResponse(resp.statusCode(), parse(resp.body()));
    }

    public JsonResponse getJson(String providerId, String url, Map<String, String> headers) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        applyHeaders(b, headers);
        HttpResponse<String> resp = send(providerId, b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new JsonResponse(resp.statusCode(), parse(resp.body()));
    }

    public BinaryResponse getBytes(String providerId, String url, Map<String, String> headers) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .GET();
        applyHeaders(b, headers);
        HttpResponse<byte[]> resp = send(providerId, b.build(), HttpResponse.BodyHandlers.ofByteArray());
        String contentType = resp.headers().firstValue("Content-Type").orElse("application/octet-stream");
        return new BinaryResponse(resp.statusCode(), contentType, resp.body());
    }

    private <T> HttpResponse<T> send(String providerId, HttpRequest req, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(req, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderExchangeException(providerId, "Запрос к провайдеру прерван: " + req.uri().getPath(), e);
        } catch (IOException e) {
            throw new ProviderExchangeException(providerId,
                    "Ошибка обращения к провайдеру " + req.uri().getHost() + ": " + SensitiveDataSanitizer.describe(e), e);
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return MissingNode.getInstance();
        }
    }

    private void applyHeaders(HttpRequest.Builder b, Map<String, String> headers) {
        if (headers == null) {
            return;
        }
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() != null && e.getValue() != null && !e.getValue().isBlank()) {
                b.setHeader(e.getKey(), e.getValue());
            }
        }
    }

    static String encodeForm(Map<String, String> form) {
        StringBuilder sb = new StringBuilder();
        if (form == null) {
            return "";
        }
        for (Map.Entry<String, String> e : form.entrySet()) {
            if (e.getValue() == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * Текст ошибки OAuth из тела ответа ({@code error} / {@code error_description}), если есть.
     */
    static String oauthError(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        String error = text(body, "error");
        if (error == null) {
            return null;
        }
        String description = text(body, "error_description");
        return description == null ? error : error + ": " + description;
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isMissingNode()) {
            return null;
        }
        String s = v.asText();
        return (s == null || s.isBlank()) ? null : s;
    }
}
