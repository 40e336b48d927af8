package ru.aritmos.padlock.core;

import io.micronaut.http.HttpStatus;

/**
 * Таксономия ошибок аутентификации и соответствующие HTTP-статусы.
 */
public enum AuthErrorCode {

    /** отсутствует/некорректен provider, code, state или тело запроса */
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    UNKNOWN_PROVIDER(HttpStatus.BAD_REQUEST),
    /** запрос к trusted-провайдеру не методом POST */
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED),
    /** Origin/Referer не совпадает с base URL */
    FORBIDDEN(HttpStatus.FORBIDDEN),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    /** token endpoint/userinfo провайдера ответил ошибкой, включая отказ по tenant */
    UPSTREAM_EXCHANGE_FAILED(HttpStatus.BAD_GATEWAY),
    CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    AuthErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
