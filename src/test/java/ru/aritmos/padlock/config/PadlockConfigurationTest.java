package ru.aritmos.padlock.config;

import io.micronaut.http.cookie.SameSite;
import org.junit.jupiter.api.Test;
import ru.aritmos.padlock.provider.ProviderModels.ProviderConfig;
import ru.aritmos.padlock.trusted.AuthenticationResult;
import ru.aritmos.padlock.trusted.TrustedProvider;
import ru.aritmos.padlock.trusted.TrustedArguments;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PadlockConfigurationTest {

    @Test
    void shouldNormalizeBaseUrlAndAuthPath() {
        PadlockConfiguration cfg = PadlockConfiguration.builder("https://app.example.com//").authPath("login/").build();

        assertEquals("https://app.example.com", cfg.baseUrl());
        assertEquals("/login", cfg.authPath());
        assertEquals("/login/callback", cfg.callbackPath());
        assertEquals("https://app.example.com/login/callback", cfg.defaultRedirectUri());
        assertEquals(PadlockConfiguration.DEFAULT_ATTEMPT_TTL_SECONDS, cfg.attemptTtlSeconds());
        assertFalse(cfg.sessionConfig().isPresent());
    }

    @Test
    void providerIdMustNotBeBothOAuthAndTrusted() {
        PadlockConfiguration.Builder builder = PadlockConfiguration.builder("http://localhost:8080")
                .provider("github", ProviderConfig.of("a", "b"))
                .trusted(trusted("github"));

        IllegalStateException ex = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(ex.getMessage().contains("github"));
    }

    @Test
    void providerMapsAreImmutable() {
        PadlockConfiguration cfg = PadlockConfiguration.builder("http://localhost:8080")
                .provider("github", ProviderConfig.of("a", "b"))
                .build();

        assertThrows(UnsupportedOperationException.class, () -> cfg.providers().put("x", ProviderConfig.of("c", "d")));
    }

    @Test
    void sessionDefaultsAndMaskedSecret() {
        SessionConfig session = SessionConfig.withSecret("0123456789abcdef0123456789abcdef");

        assertEquals(3600, session.expiresInSeconds());
        assertEquals("padlock_token", session.cookieName());
        assertEquals(SameSite.Lax, session.sameSite());
        assertEquals(3600L, session.cookieOptions().maxAgeSeconds());
        assertFalse(session.toString().contains("0123456789abcdef"));
        assertEquals(SameSite.Strict, SessionConfig.parseSameSite("STRICT"));
        assertEquals(SameSite.Lax, SessionConfig.parseSameSite("unknown"));
    }

    private static TrustedProvider trusted(String id) {
        return new TrustedProvider() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public AuthenticationResult authenticate(TrustedArguments args) {
                return AuthenticationResult.failure("not used");
            }
        };
    }
}
