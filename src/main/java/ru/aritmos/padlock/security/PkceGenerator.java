package ru.aritmos.padlock.security;

import jakarta.inject.Singleton;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Генератор пары PKCE (RFC 7636), только метод S256.
 * <p>
 * Провайдеру при инициации передаётся только challenge. Verifier хранится в cookie
 * и используется один раз, при обмене кода.
 */
@Singleton
public class PkceGenerator {

    public static final String METHOD = "S256";

    private static final int VERIFIER_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    public record PkcePair(String verifier, String challenge) {

        @Override
        public String toString() {
            return "PkcePair[challenge=" + challenge + "]";
        }
    }

    public PkcePair generate() {
        byte[] bytes = new byte[VERIFIER_BYTES];
        random.nextBytes(bytes);
        String verifier = base64Url(bytes);
        return new PkcePair(verifier, challengeFor(verifier));
    }

    /**
     * challenge = BASE64URL(SHA-256(ASCII(verifier))).
     */
    public static String challengeFor(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return base64Url(digest.digest(verifier.getBytes(StandardCharsets.US_ASCII)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен в JVM", e);
        }
    }

    static String base64Url(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }
}
