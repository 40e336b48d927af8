package ru.aritmos.padlock.security;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.filters.AuthenticationFetcher;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import ru.aritmos.padlock.config.PadlockConfiguration;
import ru.aritmos.padlock.model.SessionPayload;

import java.util.Map;

/**
 * Публикует валидную сессию Padlock как {@link Authentication} micronaut-security.
 * <p>
 * Имя: {@code sub}, атрибуты: {@code provider} и {@code providerAccountId}. Это позволяет приложению
 * защищать свои маршруты аннотацией {@code @Secured(SecurityRule.IS_AUTHENTICATED)}.
 * Без конфигурации сессии fetcher ничего не публикует.
 */
@Singleton
public class PadlockAuthenticationFetcher implements AuthenticationFetcher<HttpRequest<?>> {

    private final PadlockConfiguration configuration;
    private final SessionAuthorizer authorizer;

    public PadlockAuthenticationFetcher(PadlockConfiguration configuration, SessionAuthorizer authorizer) {
        this.configuration = configuration;
        this.authorizer = authorizer;
    }

    @Override
    public Publisher<Authentication> fetchAuthentication(HttpRequest<?> request) {
        if (configuration.session() == null) {
            return Publishers.empty();
        }
        SessionPayload payload = authorizer.authorize(request, false);
        if (payload == null) {
            return Publishers.empty();
        }
        return Publishers.just(Authentication.build(payload.sub(), Map.of(
                "provider", payload.provider(),
                "providerAccountId", payload.providerAccountId())));
    }
}
