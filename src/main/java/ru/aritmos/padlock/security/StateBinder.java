package ru.aritmos.padlock.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import ru.aritmos.padlock.core.AuthFlowException;
import ru.aritmos.padlock.core.CookieJar;
import ru.aritmos.padlock.core.CookieOptions;
import ru.aritmos.padlock.core.LoginAttemptCookies;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Anti-forgery state для OAuth-редиректа.
 * <p>
 * При инициации случайный токен сохраняется в cookie {@code oauth_state_<provider>}, а провайдеру
 * передаётся JSON {@code {"provider":…, "state":…}}. При завершении сначала по JSON определяется
 * провайдер, затем токен сравнивается с cookie этого провайдера. Совпасть может только у стороны,
 * получившей cookie при инициации.
 */
@Singleton
public class StateBinder {

    private static final int TOKEN_BYTES = 32;

    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    public StateBinder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Разобранный wire-параметр {@code state}.
     */
    public record WireState(String provider, String state) {
    }

    /**
     * Сгенерировать state, сохранить токен в cookie и вернуть wire-значение параметра {@code state}.
     */
    public String bind(String providerId, CookieJar cookies, CookieOptions options) {
        String token = randomToken();
        cookies.set(LoginAttemptCookies.state(providerId), token, options);
        return objectMapper.createObjectNode()
                .put("provider", providerId)
                .put("state", token)
                .toString();
    }

    /**
     * @throws AuthFlowException BAD_REQUEST, если параметр не является ожидаемым JSON
     */
    public WireState parse(String wireState) {
        return tryParse(wireState).orElseThrow(() -> AuthFlowException.badRequest("invalid state"));
    }

    /**
     * Разобрать wire-параметр без исключений.
     *
     * @return пусто, если параметр отсутствует или не является ожидаемым JSON
     */
    public Optional<WireState> tryParse(String wireState) {
        if (wireState == null || wireState.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(wireState);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String provider = textual(node, "provider");
        String state = textual(node, "state");
        if (provider == null || state == null) {
            return Optional.empty();
        }
        return Optional.of(new WireState(provider, state));
    }

    /**
     * Сравнение за постоянное время. Отсутствующий ожидаемый токен: всегда несовпадение.
     */
    public boolean matches(WireState wireState, String expectedToken) {
        if (wireState == null || expectedToken == null || expectedToken.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                wireState.state().getBytes(StandardCharsets.UTF_8),
                expectedToken.getBytes(StandardCharsets.UTF_8));
    }

    private String randomToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String textual(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            return null;
        }
        return v.asText();
    }
}
