package ru.aritmos.padlock.core;

/**
 * Имена одноразовых cookie попытки входа.
 * <p>
 * Ключуются идентификатором провайдера, чтобы параллельные попытки разных провайдеров
 * (например, две вкладки) не перетирали друг друга.
 */
public final class LoginAttemptCookies {

    public static final String PKCE_PREFIX = "pkce_";
    public static final String STATE_PREFIX = "oauth_state_";

    private LoginAttemptCookies() {
    }

    public static String pkce(String providerId) {
        return PKCE_PREFIX + providerId;
    }

    public static String state(String providerId) {
        return STATE_PREFIX + providerId;
    }

    /**
     * Удалить обе cookie попытки входа провайдера.
     */
    public static void clear(CookieJar cookies, String providerId, String callbackPath) {
        cookies.delete(pkce(providerId), callbackPath);
        cookies.delete(state(providerId), callbackPath);
    }
}
