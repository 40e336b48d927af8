package ru.aritmos.padlock.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Typed-конфигурация Padlock из application.yml/ENV.
 * <p>
 * Используется только для чтения настроек при старте; в рантайме ядро работает
 * с неизменяемым {@link PadlockConfiguration}.
 */
@ConfigurationProperties("padlock")
public class PadlockProperties {

    private String baseUrl = "http://localhost:8080";
    private String authPath = PadlockConfiguration.DEFAULT_AUTH_PATH;
    private long attemptTtlSeconds = PadlockConfiguration.DEFAULT_ATTEMPT_TTL_SECONDS;
    private InvalidConfigurationMode onInvalidConfiguration = InvalidConfigurationMode.WARN;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getAuthPath() {
        return authPath;
    }

    public void setAuthPath(String authPath) {
        this.authPath = (authPath == null || authPath.isBlank()) ? PadlockConfiguration.DEFAULT_AUTH_PATH : authPath.trim();
    }

    public long getAttemptTtlSeconds() {
        return attemptTtlSeconds;
    }

    public void setAttemptTtlSeconds(long attemptTtlSeconds) {
        this.attemptTtlSeconds = attemptTtlSeconds <= 0 ? PadlockConfiguration.DEFAULT_ATTEMPT_TTL_SECONDS : attemptTtlSeconds;
    }

    public InvalidConfigurationMode getOnInvalidConfiguration() {
        return onInvalidConfiguration;
    }

    public void setOnInvalidConfiguration(InvalidConfigurationMode onInvalidConfiguration) {
        this.onInvalidConfiguration = onInvalidConfiguration == null ? InvalidConfigurationMode.WARN : onInvalidConfiguration;
    }
}
