package ru.aritmos.padlock.core;

import java.util.Optional;

/**
 * Cookie одного HTTP-обмена (запрос + ответ).
 * <p>
 * Не разделяется между запросами. Изменения видны последующим {@link #get(String)} того же обмена.
 */
public interface CookieJar {

    Optional<String> get(String name);

    void set(String name, String value, CookieOptions options);

    void delete(String name, String path);
}
