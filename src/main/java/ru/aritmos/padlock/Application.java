package ru.aritmos.padlock;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа Padlock.
 * <p>
 * Сервис аутентифицирует пользователей через внешних OAuth2-провайдеров (Authorization Code + PKCE)
 * или через trusted-провайдеров приложения, приводит результат к единому {@code OAuthUser}
 * и выдаёт подписанную сессию в cookie.
 * <p>
 * Важно: сервис не хранит ни пользователей, ни сессии. Единственная точка сохранения: callback приложения.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
