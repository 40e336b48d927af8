package ru.aritmos.padlock.core;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.cookie.Cookie;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CookieJar} поверх cookie Micronaut.
 * <p>
 * Читает cookie входящего запроса, накапливает установки/удаления и применяет их к тому ответу,
 * который в итоге будет сформирован, успешному или ошибочному. Благодаря этому удаление
 * одноразовых cookie попытки входа доходит до браузера и при неуспешном завершении.
 */
public final class ExchangeCookieJar implements CookieJar {

    private final Map<String, String> values = new LinkedHashMap<>();
    private final Map<String, Cookie> pending = new LinkedHashMap<>();

    public ExchangeCookieJar(Map<String, String> incoming) {
        if (incoming != null) {
            incoming.forEach((k, v) -> {
                if (k != null && v != null) {
                    values.put(k, v);
                }
            });
        }
    }

    public static ExchangeCookieJar from(HttpRequest<?> request) {
        Map<String, String> incoming = new LinkedHashMap<>();
        if (request != null) {
            for (Cookie cookie : request.getCookies().getAll()) {
                incoming.put(cookie.getName(), cookie.getValue());
            }
        }
        return new ExchangeCookieJar(incoming);
    }

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    @Override
    public void set(String name, String value, CookieOptions options) {
        Cookie cookie = Cookie.of(name, value)
                .httpOnly(options.httpOnly())
                .secure(options.secure())
                .path(options.path());
        if (options.sameSite() != null) {
            cookie.sameSite(options.sameSite());
        }
        if (options.maxAgeSeconds() != null) {
            cookie.maxAge(options.maxAgeSeconds());
        }
        values.put(name, value);
        pending.put(name, cookie);
    }

    @Override
    public void delete(String name, String path) {
        values.remove(name);
        pending.put(name, Cookie.of(name, "").path(path).maxAge(0));
    }

    /**
     * @return накопленные Set-Cookie (по одной на имя, последнее изменение)
     */
    public List<Cookie> pendingCookies() {
        return List.copyOf(pending.values());
    }

    public <T extends MutableHttpResponse<?>> T applyTo(T response) {
        for (Cookie cookie : pending.values()) {
            response.cookie(cookie);
        }
        return response;
    }
}
