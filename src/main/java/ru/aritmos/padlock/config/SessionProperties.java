package ru.aritmos.padlock.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Requires;

/**
 * Настройки сессионного токена: {@code padlock.session.*}.
 * <p>
 * Bean существует только при заданном {@code padlock.session.secret}; без него сессия не выдаётся,
 * а проверка авторизации завершается ошибкой конфигурации.
 */
@ConfigurationProperties("padlock.session")
@Requires(property = "padlock.session.secret")
public class SessionProperties {

    private String secret;
    private long expiresInSeconds = SessionConfig.DEFAULT_EXPIRES_IN_SECONDS;
    private Cookie cookie = new Cookie();

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public long getExpiresInSeconds() {
        return expiresInSeconds;
    }

    public void setExpiresInSeconds(long expiresInSeconds) {
        this.expiresInSeconds = expiresInSeconds;
    }

    public Cookie getCookie() {
        return cookie;
    }

    public void setCookie(Cookie cookie) {
        this.cookie = cookie == null ? new Cookie() : cookie;
    }

    public SessionConfig toConfig() {
        return new SessionConfig(
                secret,
                expiresInSeconds,
                cookie.getName(),
                cookie.isHttpOnly(),
                SessionConfig.parseSameSite(cookie.getSameSite()),
                cookie.isSecure(),
                cookie.getPath()
        );
    }

    @ConfigurationProperties("cookie")
    public static class Cookie {
        private String name = SessionConfig.DEFAULT_COOKIE_NAME;
        private boolean httpOnly = true;
        private String sameSite = "lax";
        private boolean secure = false;
        private String path = "/";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = (name == null || name.isBlank()) ? SessionConfig.DEFAULT_COOKIE_NAME : name.trim();
        }

        public boolean isHttpOnly() {
            return httpOnly;
        }

        public void setHttpOnly(boolean httpOnly) {
            this.httpOnly = httpOnly;
        }

        public String getSameSite() {
            return sameSite;
        }

        public void setSameSite(String sameSite) {
            this.sameSite = sameSite;
        }

        public boolean isSecure() {
            return secure;
        }

        public void setSecure(boolean secure) {
            this.secure = secure;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = (path == null || path.isBlank()) ? "/" : path.trim();
        }
    }
}
