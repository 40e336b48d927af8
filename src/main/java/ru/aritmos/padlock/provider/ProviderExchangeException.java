package ru.aritmos.padlock.provider;

/**
 * Ошибка взаимодействия с провайдером: не-2xx ответ, некорректный ответ или транспортная ошибка
 * token endpoint / userinfo.
 * <p>
 * Не несёт HTTP-статуса: провайдеры ничего не знают о хост-слое, отображение выполняет оркестратор.
 */
public class ProviderExchangeException extends RuntimeException {

    private final String providerId;

    public ProviderExchangeException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public ProviderExchangeException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String providerId() {
        return providerId;
    }
}
