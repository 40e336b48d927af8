package ru.aritmos.padlock.trusted;

import ru.aritmos.padlock.model.OAuthUser;

/**
 * Результат trusted-аутентификации.
 *
 * @param user нормализованный пользователь (только при успехе)
 * @param reason причина отказа для логов (только при неуспехе); клиенту не отдаётся
 */
public record AuthenticationResult(OAuthUser user, String reason) {

    public static AuthenticationResult success(OAuthUser user) {
        if (user == null) {
            throw new IllegalArgumentException("user обязателен для успешного результата");
        }
        return new AuthenticationResult(user, null);
    }

    public static AuthenticationResult failure(String reason) {
        return new AuthenticationResult(null, reason);
    }

    public boolean authenticated() {
        return user != null;
    }
}
