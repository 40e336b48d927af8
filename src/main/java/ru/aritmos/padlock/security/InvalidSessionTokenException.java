package ru.aritmos.padlock.security;

/**
 * Сессионный токен не прошёл проверку: повреждён, подписан другим ключом, истёк
 * или содержит несогласованные claims.
 */
public class InvalidSessionTokenException extends RuntimeException {

    public InvalidSessionTokenException(String message) {
        super(message);
    }

    public InvalidSessionTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
