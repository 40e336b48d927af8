package ru.aritmos.padlock.core;

/**
 * Санитайзер чувствительных данных для логов и текстов ошибок.
 * <p>
 * Назначение:
 * <ul>
 *   <li>не допустить вывода access token, client secret, кода авторизации и PKCE verifier;</li>
 *   <li>обеспечить единообразную политику «маскирования» во всех местах, где пишется текст ошибки.</li>
 * </ul>
 * <p>
 * Важно: санитайзер работает эвристически и не заменяет правило «секреты в сообщения не попадают».
 */
public final class SensitiveDataSanitizer {

    /**
     * Маска для скрытия чувствительных значений.
     */
    private static final String MASK = "***";

    private SensitiveDataSanitizer() {
    }

    /**
     * Санитизировать текст (сообщения об ошибках, диагностические строки).
     * <p>
     * Эвристика:
     * <ul>
     *   <li>маскируем Bearer-токены;</li>
     *   <li>маскируем client_secret=..., code=..., code_verifier=... и похожие пары;</li>
     *   <li>маскируем JSON-поля access_token/id_token/refresh_token.</li>
     * </ul>
     *
     * @param text исходный текст
     * @return санитизированный текст
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = text;

        // Bearer <token>
        t = t.replaceAll("(?i)bearer\\s+[^\\s\"]+", "Bearer " + MASK);

        // Параметры формата key=value
        t = t.replaceAll("(?i)\\b(client_secret|access_token|refresh_token|id_token|code_verifier|code)\\s*=\\s*[^\\s&\"]+", "$1=" + MASK);

        // JSON "access_token":"..."
        t = t.replaceAll("(?i)\"(client_secret|access_token|refresh_token|id_token)\"\\s*:\\s*\"[^\"]*\"", "\"$1\":\"" + MASK + "\"");

        // Избегаем многострочности в сообщениях.
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }

    /**
     * Безопасное сообщение исключения (класс, если сообщения нет).
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String msg = error.getMessage();
        if (msg == null || msg.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return sanitizeText(msg);
    }
}
