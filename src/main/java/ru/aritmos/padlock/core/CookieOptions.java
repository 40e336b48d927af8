package ru.aritmos.padlock.core;

import io.micronaut.http.cookie.SameSite;

/**
 * Атрибуты устанавливаемой cookie.
 *
 * @param httpOnly недоступна из JavaScript
 * @param sameSite политика SameSite
 * @param secure только HTTPS
 * @param path область действия по пути
 * @param maxAgeSeconds время жизни; {@code null}: сессионная cookie браузера
 */
public record CookieOptions(
        boolean httpOnly,
        SameSite sameSite,
        boolean secure,
        String path,
        Long maxAgeSeconds
) {

    /**
     * Короткоживущая cookie попытки входа (PKCE verifier, state).
     */
    public static CookieOptions ephemeral(String path, long maxAgeSeconds) {
        return new CookieOptions(true, SameSite.Lax, false, path, maxAgeSeconds);
    }
}
