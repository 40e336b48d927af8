package ru.aritmos.padlock.model;

import io.micronaut.core.annotation.Introspected;

import java.util.Objects;

/**
 * Полезная нагрузка сессионного токена.
 * <p>
 * {@code sub} всегда выводится из {@code provider} и {@code providerAccountId} и никогда не задаётся отдельно,
 * поэтому экземпляры создаются только через {@link #of(String, String)} / {@link #of(OAuthUser)}.
 */
@Introspected
public record SessionPayload(String sub, String provider, String providerAccountId) {

    public SessionPayload {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(providerAccountId, "providerAccountId");
        String expected = subjectOf(provider, providerAccountId);
        if (!expected.equals(sub)) {
            throw new IllegalArgumentException("sub должен быть равен provider:providerAccountId");
        }
    }

    public static SessionPayload of(String provider, String providerAccountId) {
        return new SessionPayload(subjectOf(provider, providerAccountId), provider, providerAccountId);
    }

    public static SessionPayload of(OAuthUser user) {
        return of(user.provider(), user.providerAccountId());
    }

    public static String subjectOf(String provider, String providerAccountId) {
        return provider + ":" + providerAccountId;
    }
}
