package ru.aritmos.padlock.security;

import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import org.junit.jupiter.api.Test;
import ru.aritmos.padlock.core.AuthErrorCode;
import ru.aritmos.padlock.core.AuthFlowException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OriginGuardTest {

    private static final String BASE_URL = "https://app.example.com";

    private final OriginGuard guard = new OriginGuard();

    @Test
    void shouldAllowRequestWithoutOriginAndReferer() {
        assertDoesNotThrow(() -> guard.enforce(HttpRequest.POST("/auth?provider=password", ""), BASE_URL));
    }

    @Test
    void shouldAllowSameOriginWithExplicitDefaultPort() {
        HttpRequest<?> request = HttpRequest.POST("/auth?provider=password", "")
                .header(HttpHeaders.ORIGIN, "https://APP.example.com:443")
                .header(HttpHeaders.REFERER, "https://app.example.com/login?next=/");

        assertDoesNotThrow(() -> guard.enforce(request, BASE_URL));
    }

    @Test
    void shouldRejectCrossOrigin() {
        HttpRequest<?> request = HttpRequest.POST("/auth?provider=password", "")
                .header(HttpHeaders.ORIGIN, "https://evil.example.com");

        AuthFlowException ex = assertThrows(AuthFlowException.class, () -> guard.enforce(request, BASE_URL));
        assertEquals(AuthErrorCode.FORBIDDEN, ex.code());
        assertEquals("invalid origin", ex.getMessage());
    }

    @Test
    void shouldRejectCrossOriginReferer() {
        HttpRequest<?> request = HttpRequest.POST("/auth?provider=password", "")
                .header(HttpHeaders.REFERER, "http://app.example.com/login");

        AuthFlowException ex = assertThrows(AuthFlowException.class, () -> guard.enforce(request, BASE_URL));
        assertEquals("invalid referer", ex.getMessage());
    }

    @Test
    void shouldTreatUnparseableHeaderAsMismatch() {
        HttpRequest<?> request = HttpRequest.POST("/auth?provider=password", "")
                .header(HttpHeaders.ORIGIN, "not a url");

        assertThrows(AuthFlowException.class, () -> guard.enforce(request, BASE_URL));
    }

    @Test
    void originOfNormalizesDefaultPorts() {
        assertEquals("http://localhost:80", OriginGuard.originOf("http://localhost/"));
        assertEquals("https://localhost:8443", OriginGuard.originOf("https://LOCALHOST:8443/x"));
        assertNull(OriginGuard.originOf("/relative/path"));
    }
}
