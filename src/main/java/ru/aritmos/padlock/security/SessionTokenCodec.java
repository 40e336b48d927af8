package ru.aritmos.padlock.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.padlock.model.SessionPayload;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Выпуск и проверка сессионного токена (JWT, HS256).
 * <p>
 * Claims: {@code sub}, {@code provider}, {@code providerAccountId}, {@code iat}, {@code exp}.
 * Серверного хранилища сессий нет: токен самодостаточен.
 */
@Singleton
public class SessionTokenCodec {

    public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    static final String CLAIM_PROVIDER = "provider";
    static final String CLAIM_ACCOUNT_ID = "providerAccountId";

    private final Clock clock;

    @Inject
    public SessionTokenCodec() {
        this(Clock.systemUTC());
    }

    public SessionTokenCodec(Clock clock) {
        this.clock = clock;
    }

    public String issue(SessionPayload payload, String secret) {
        return issue(payload, secret, DEFAULT_EXPIRES_IN_SECONDS);
    }

    public String issue(SessionPayload payload, String secret, long expiresInSeconds) {
        Instant now = clock.instant();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(payload.sub())
                .claim(CLAIM_PROVIDER, payload.provider())
                .claim(CLAIM_ACCOUNT_ID, payload.providerAccountId())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plusSeconds(expiresInSeconds)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(new MACSigner(secretBytes(secret)));
        } catch (JOSEException e) {
            throw new IllegalStateException("Не удалось подписать сессионный токен: " + e.getMessage(), e);
        }
        return jwt.serialize();
    }

    /**
     * @throws InvalidSessionTokenException если токен повреждён, подпись не сходится, срок истёк
     *                                      или {@code sub} не равен {@code provider:providerAccountId}
     */
    public SessionPayload verify(String token, String secret) {
        if (token == null || token.isBlank()) {
            throw new InvalidSessionTokenException("token is empty");
        }
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new InvalidSessionTokenException("malformed token", e);
        }
        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
            throw new InvalidSessionTokenException("unexpected algorithm " + jwt.getHeader().getAlgorithm());
        }
        try {
            if (!jwt.verify(new MACVerifier(secretBytes(secret)))) {
                throw new InvalidSessionTokenException("invalid signature");
            }
        } catch (JOSEException e) {
            throw new InvalidSessionTokenException("signature check failed", e);
        }

        JWTClaimsSet claims;
        String provider;
        String accountId;
        try {
            claims = jwt.getJWTClaimsSet();
            provider = claims.getStringClaim(CLAIM_PROVIDER);
            accountId = claims.getStringClaim(CLAIM_ACCOUNT_ID);
        } catch (ParseException e) {
            throw new InvalidSessionTokenException("malformed claims", e);
        }

        Date exp = claims.getExpirationTime();
        if (exp == null || !clock.instant().isBefore(exp.toInstant())) {
            throw new InvalidSessionTokenException("token expired");
        }
        if (provider == null || accountId == null) {
            throw new InvalidSessionTokenException("missing claims");
        }
        if (!SessionPayload.subjectOf(provider, accountId).equals(claims.getSubject())) {
            throw new InvalidSessionTokenException("inconsistent subject");
        }
        return SessionPayload.of(provider, accountId);
    }

    private static byte[] secretBytes(String secret) {
        if (secret == null) {
            throw new IllegalStateException("Секрет сессии не задан");
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}
