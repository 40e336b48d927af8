package ru.aritmos.padlock.security;

import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.cookie.Cookie;
import org.junit.jupiter.api.Test;
import ru.aritmos.padlock.config.PadlockConfiguration;
import ru.aritmos.padlock.config.SessionConfig;
import ru.aritmos.padlock.core.AuthErrorCode;
import ru.aritmos.padlock.core.AuthFlowException;
import ru.aritmos.padlock.model.SessionPayload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SessionAuthorizerTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    private final SessionTokenCodec codec = new SessionTokenCodec();
    private final SessionAuthorizer authorizer = new SessionAuthorizer(
            PadlockConfiguration.builder("http://localhost:8080").session(SessionConfig.withSecret(SECRET)).build(),
            codec);

    @Test
    void shouldFailOrReturnNullWithoutToken() {
        HttpRequest<?> request = HttpRequest.GET("/private");

        AuthFlowException ex = assertThrows(AuthFlowException.class, () -> authorizer.authorize(request, true));
        assertEquals(AuthErrorCode.UNAUTHORIZED, ex.code());
        assertNull(authorizer.authorize(request, false));
    }

    @Test
    void shouldReturnPayloadFromCookie() {
        String token = codec.issue(SessionPayload.of("github", "42"), SECRET);
        HttpRequest<?> request = HttpRequest.GET("/private").cookie(Cookie.of("padlock_token", token));

        SessionPayload payload = authorizer.authorize(request, true);

        assertEquals("github:42", payload.sub());
        assertEquals("github", payload.provider());
        assertEquals("42", payload.providerAccountId());
    }

    @Test
    void bearerHeaderTakesPrecedenceOverCookie() {
        String headerToken = codec.issue(SessionPayload.of("microsoft", "abc"), SECRET);
        String cookieToken = codec.issue(SessionPayload.of("github", "42"), SECRET);
        HttpRequest<?> request = HttpRequest.GET("/private")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + headerToken)
                .cookie(Cookie.of("padlock_token", cookieToken));

        assertEquals("microsoft:abc", authorizer.authorize(request, true).sub());
    }

    @Test
    void shouldTreatInvalidTokenLikeMissingToken() {
        HttpRequest<?> request = HttpRequest.GET("/private").header(HttpHeaders.AUTHORIZATION, "Bearer garbage");

        assertThrows(AuthFlowException.class, () -> authorizer.authorize(request, true));
        assertNull(authorizer.authorize(request, false));
    }

    @Test
    void shouldFailFastWithoutSessionConfiguration() {
        SessionAuthorizer noSession = new SessionAuthorizer(PadlockConfiguration.builder("http://localhost:8080").build(), codec);

        AuthFlowException ex = assertThrows(AuthFlowException.class,
                () -> noSession.authorize(HttpRequest.GET("/private"), false));
        assertEquals(AuthErrorCode.CONFIGURATION_ERROR, ex.code());
    }
}
