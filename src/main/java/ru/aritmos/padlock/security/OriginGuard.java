package ru.aritmos.padlock.security;

import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import jakarta.inject.Singleton;
import ru.aritmos.padlock.core.AuthErrorCode;
import ru.aritmos.padlock.core.AuthFlowException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * CSRF-проверка источника для изменяющих состояние запросов без provider-issued state
 * (POST к trusted-провайдеру).
 * <p>
 * Если присутствует {@code Origin} или {@code Referer}, его origin (scheme + host + port) обязан совпадать
 * с origin base URL. Запрос без обоих заголовков пропускается: часть клиентов их не отправляет.
 */
@Singleton
public class OriginGuard {

    public void enforce(HttpRequest<?> request, String baseUrl) {
        String expected = originOf(baseUrl);

        String origin = request.getHeaders().get(HttpHeaders.ORIGIN);
        if (origin != null && !origin.isBlank() && !sameOrigin(origin, expected)) {
            throw new AuthFlowException(AuthErrorCode.FORBIDDEN, "invalid origin");
        }

        String referer = request.getHeaders().get(HttpHeaders.REFERER);
        if (referer != null && !referer.isBlank() && !sameOrigin(referer, expected)) {
            throw new AuthFlowException(AuthErrorCode.FORBIDDEN, "invalid referer");
        }
    }

    private static boolean sameOrigin(String candidate, String expected) {
        String actual = originOf(candidate);
        return actual != null && actual.equals(expected);
    }

    /**
     * Нормализованный origin {@code scheme://host:port} или {@code null}, если URL не разбирается.
     */
    static String originOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) {
                return null;
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            int port = uri.getPort();
            if (port == -1) {
                port = switch (scheme) {
                    case "http" -> 80;
                    case "https" -> 443;
                    default -> -1;
                };
            }
            return scheme + "://" + host.toLowerCase(Locale.ROOT) + ":" + port;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
