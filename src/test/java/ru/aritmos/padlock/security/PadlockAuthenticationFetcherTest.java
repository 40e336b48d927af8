package ru.aritmos.padlock.security;

import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import ru.aritmos.padlock.config.PadlockConfiguration;
import ru.aritmos.padlock.config.SessionConfig;
import ru.aritmos.padlock.model.SessionPayload;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PadlockAuthenticationFetcherTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    private final SessionTokenCodec codec = new SessionTokenCodec();

    @Test
    void shouldExposeValidSessionAsAuthentication() {
        PadlockAuthenticationFetcher fetcher = fetcher(PadlockConfiguration.builder("http://localhost:8080")
                .session(SessionConfig.withSecret(SECRET))
                .build());
        String token = codec.issue(SessionPayload.of("github", "42"), SECRET);

        List<Authentication> result = collect(fetcher.fetchAuthentication(
                HttpRequest.GET("/private").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)));

        assertEquals(1, result.size());
        assertEquals("github:42", result.get(0).getName());
        assertEquals("github", result.get(0).getAttributes().get("provider"));
        assertEquals("42", result.get(0).getAttributes().get("providerAccountId"));
    }

    @Test
    void shouldPublishNothingWithoutValidSessionOrSessionConfiguration() {
        PadlockAuthenticationFetcher withSession = fetcher(PadlockConfiguration.builder("http://localhost:8080")
                .session(SessionConfig.withSecret(SECRET))
                .build());
        PadlockAuthenticationFetcher withoutSession = fetcher(PadlockConfiguration.builder("http://localhost:8080").build());

        assertTrue(collect(withSession.fetchAuthentication(HttpRequest.GET("/private"))).isEmpty());
        assertTrue(collect(withSession.fetchAuthentication(
                HttpRequest.GET("/private").header(HttpHeaders.AUTHORIZATION, "Bearer broken"))).isEmpty());
        assertTrue(collect(withoutSession.fetchAuthentication(HttpRequest.GET("/private"))).isEmpty());
    }

    private PadlockAuthenticationFetcher fetcher(PadlockConfiguration configuration) {
        return new PadlockAuthenticationFetcher(configuration, new SessionAuthorizer(configuration, codec));
    }

    private static List<Authentication> collect(Publisher<Authentication> publisher) {
        List<Authentication> out = new ArrayList<>();
        publisher.subscribe(new Subscriber<>() {
            @Override
            public void onSubscribe(Subscription s) {
                s.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(Authentication authentication) {
                out.add(authentication);
            }

            @Override
            public void onError(Throwable t) {
                throw new AssertionError(t);
            }

            @Override
            public void onComplete() {
                // синхронные Publishers.just/empty завершаются сразу
            }
        });
        return out;
    }
}
