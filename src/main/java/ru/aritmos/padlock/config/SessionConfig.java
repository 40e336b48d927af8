package ru.aritmos.padlock.config;

import io.micronaut.http.cookie.SameSite;
import ru.aritmos.padlock.core.CookieOptions;

import java.util.Locale;

/**
 * Неизменяемые настройки сессии.
 *
 * @param secret HMAC-секрет (не короче 32 байт)
 * @param expiresInSeconds срок жизни токена и cookie
 * @param cookieName имя cookie сессии
 * @param httpOnly атрибут HttpOnly
 * @param sameSite атрибут SameSite
 * @param secure атрибут Secure
 * @param path атрибут Path
 */
public record SessionConfig(
        String secret,
        long expiresInSeconds,
        String cookieName,
        boolean httpOnly,
        SameSite sameSite,
        boolean secure,
        String path
) {

    public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;
    public static final String DEFAULT_COOKIE_NAME = "padlock_token";

    public SessionConfig {
        expiresInSeconds = expiresInSeconds <= 0 ? DEFAULT_EXPIRES_IN_SECONDS : expiresInSeconds;
        cookieName = (cookieName == null || cookieName.isBlank()) ? DEFAULT_COOKIE_NAME : cookieName;
        sameSite = sameSite == null ? SameSite.Lax : sameSite;
        path = (path == null || path.isBlank()) ? "/" : path;
    }

    /**
     * Настройки по умолчанию: 3600 секунд, {@code padlock_token}, HttpOnly, SameSite=Lax, без Secure, Path=/.
     */
    public static SessionConfig withSecret(String secret) {
        return new SessionConfig(secret, DEFAULT_EXPIRES_IN_SECONDS, DEFAULT_COOKIE_NAME, true, SameSite.Lax, false, "/");
    }

    public CookieOptions cookieOptions() {
        return new CookieOptions(httpOnly, sameSite, secure, path, expiresInSeconds);
    }

    static SameSite parseSameSite(String value) {
        if (value == null || value.isBlank()) {
            return SameSite.Lax;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "strict" -> SameSite.Strict;
            case "none" -> SameSite.None;
            default -> SameSite.Lax;
        };
    }

    @Override
    public String toString() {
        return "SessionConfig[secret=***, expiresInSeconds=" + expiresInSeconds
                + ", cookieName=" + cookieName + ", httpOnly=" + httpOnly
                + ", sameSite=" + sameSite + ", secure=" + secure + ", path=" + path + "]";
    }
}
