package ru.aritmos.padlock.trusted;

/**
 * Trusted-провайдер: проверка учётных данных, реализованная приложением (например, вход по паролю).
 * <p>
 * Реализации регистрируются как bean'ы. Аргументы передаются позиционно из тела
 * {@code {"args": [...]}} POST-запроса; их количество и типы определяет сам провайдер.
 * <p>
 * Неуспех сообщается через {@link AuthenticationResult#failure(String)}. Возврат {@code null}
 * и выброшенное исключение трактуются так же: «аутентификация не пройдена».
 */
public interface TrustedProvider {

    /**
     * @return имя провайдера, по которому он выбирается параметром {@code provider}
     */
    String id();

    AuthenticationResult authenticate(TrustedArguments args);
}
