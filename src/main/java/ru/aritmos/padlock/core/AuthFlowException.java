package ru.aritmos.padlock.core;

import io.micronaut.http.HttpStatus;

/**
 * Ошибка потока аутентификации с явным HTTP-статусом.
 * <p>
 * Такие ошибки пробрасываются вызывающему без изменений. Любая другая ошибка внутри
 * {@code complete} оборачивается в {@link AuthErrorCode#INTERNAL}.
 * Важно: сообщение не должно содержать секретов, токенов и кодов авторизации.
 */
public class AuthFlowException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthFlowException(AuthErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AuthFlowException(AuthErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AuthErrorCode code() {
        return code;
    }

    public HttpStatus status() {
        return code.status();
    }

    public static AuthFlowException badRequest(String message) {
        return new AuthFlowException(AuthErrorCode.BAD_REQUEST, message);
    }

    public static AuthFlowException unauthorized(String message) {
        return new AuthFlowException(AuthErrorCode.UNAUTHORIZED, message);
    }

    public static AuthFlowException configuration(String message) {
        return new AuthFlowException(AuthErrorCode.CONFIGURATION_ERROR, message);
    }
}
