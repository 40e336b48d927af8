package ru.aritmos.padlock.security;

import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.cookie.Cookie;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.padlock.config.PadlockConfiguration;
import ru.aritmos.padlock.config.SessionConfig;
import ru.aritmos.padlock.core.AuthFlowException;
import ru.aritmos.padlock.model.SessionPayload;

/**
 * Проверка сессии для защищённых маршрутов приложения.
 * <p>
 * Токен берётся из {@code Authorization: Bearer …}, иначе из cookie сессии; заголовок приоритетнее.
 */
@Singleton
public class SessionAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthorizer.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final PadlockConfiguration configuration;
    private final SessionTokenCodec codec;

    public SessionAuthorizer(PadlockConfiguration configuration, SessionTokenCodec codec) {
        this.configuration = configuration;
        this.codec = codec;
    }

    /**
     * @param required {@code true}: отсутствие или невалидность токена даёт UNAUTHORIZED,
     *                 {@code false}: возвращается {@code null}
     * @return payload валидной сессии или {@code null}
     * @throws AuthFlowException CONFIGURATION_ERROR, если сессия не сконфигурирована
     */
    public SessionPayload authorize(HttpRequest<?> request, boolean required) {
        SessionConfig session = configuration.sessionConfig()
                .orElseThrow(() -> AuthFlowException.configuration("session configuration is missing"));

        String token = extractToken(request, session.cookieName());
        if (token == null) {
            if (required) {
                throw AuthFlowException.unauthorized("invalid or missing token");
            }
            return null;
        }

        try {
            return codec.verify(token, session.secret());
        } catch (InvalidSessionTokenException e) {
            log.debug("Сессионный токен отклонён: {}", e.getMessage());
            if (required) {
                throw AuthFlowException.unauthorized("invalid token");
            }
            return null;
        }
    }

    static String extractToken(HttpRequest<?> request, String cookieName) {
        String header = request.getHeaders().get(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        return request.getCookies().findCookie(cookieName)
                .map(Cookie::getValue)
                .filter(v -> !v.isEmpty())
                .orElse(null);
    }
}
