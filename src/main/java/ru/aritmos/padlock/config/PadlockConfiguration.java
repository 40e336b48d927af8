package ru.aritmos.padlock.config;

import ru.aritmos.padlock.core.PadlockCallbacks;
import ru.aritmos.padlock.provider.ProviderModels.ProviderConfig;
import ru.aritmos.padlock.trusted.TrustedProvider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Неизменяемая конфигурация ядра аутентификации.
 * <p>
 * Собирается один раз при старте и разделяется всеми запросами только на чтение,
 * поэтому синхронизация не нужна.
 *
 * @param baseUrl базовый URL приложения без завершающего «/»
 * @param authPath путь маршрутов аутентификации ({@code /auth})
 * @param attemptTtlSeconds время жизни cookie попытки входа
 * @param onInvalidConfiguration реакция на проблемы конфигурации
 * @param providers OAuth-провайдеры: id → настройки
 * @param trustedProviders trusted-провайдеры: id → реализация
 * @param session настройки сессии ({@code null}: сессия не выдаётся)
 * @param userCallback хук после аутентификации (может быть {@code null})
 * @param errorCallback хук ошибок завершения входа (может быть {@code null})
 */
public record PadlockConfiguration(
        String baseUrl,
        String authPath,
        long attemptTtlSeconds,
        InvalidConfigurationMode onInvalidConfiguration,
        Map<String, ProviderConfig> providers,
        Map<String, TrustedProvider> trustedProviders,
        SessionConfig session,
        PadlockCallbacks.UserCallback userCallback,
        PadlockCallbacks.ErrorCallback errorCallback
) {

    public static final String DEFAULT_AUTH_PATH = "/auth";
    public static final long DEFAULT_ATTEMPT_TTL_SECONDS = 300;

    public PadlockConfiguration {
        baseUrl = stripTrailingSlash(baseUrl == null ? "" : baseUrl.trim());
        authPath = normalizePath(authPath);
        attemptTtlSeconds = attemptTtlSeconds <= 0 ? DEFAULT_ATTEMPT_TTL_SECONDS : attemptTtlSeconds;
        onInvalidConfiguration = onInvalidConfiguration == null ? InvalidConfigurationMode.WARN : onInvalidConfiguration;
        providers = freeze(providers);
        trustedProviders = freeze(trustedProviders);

        for (String id : providers.keySet()) {
            if (trustedProviders.containsKey(id)) {
                throw new IllegalStateException("Провайдер '" + id + "' объявлен одновременно как OAuth и как trusted");
            }
        }
    }

    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    public Optional<SessionConfig> sessionConfig() {
        return Optional.ofNullable(session);
    }

    /**
     * @return путь callback-маршрута; им же ограничены cookie попытки входа
     */
    public String callbackPath() {
        return authPath + "/callback";
    }

    public String defaultRedirectUri() {
        return baseUrl + callbackPath();
    }

    /**
     * @return переопределённый redirect URI провайдера или {@code ${baseUrl}${authPath}/callback}
     */
    public String redirectUriFor(ProviderConfig config) {
        if (config != null && config.redirectUri() != null) {
            return config.redirectUri();
        }
        return defaultRedirectUri();
    }

    private static String stripTrailingSlash(String value) {
        String v = value;
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            return DEFAULT_AUTH_PATH;
        }
        String p = stripTrailingSlash(path.trim());
        if (p.isEmpty()) {
            return DEFAULT_AUTH_PATH;
        }
        return p.startsWith("/") ? p : "/" + p;
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Сборка конфигурации в коде (тесты, встраивание без DI).
     */
    public static final class Builder {

        private final String baseUrl;
        private String authPath = DEFAULT_AUTH_PATH;
        private long attemptTtlSeconds = DEFAULT_ATTEMPT_TTL_SECONDS;
        private InvalidConfigurationMode onInvalidConfiguration = InvalidConfigurationMode.WARN;
        private final Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        private final Map<String, TrustedProvider> trustedProviders = new LinkedHashMap<>();
        private SessionConfig session;
        private PadlockCallbacks.UserCallback userCallback;
        private PadlockCallbacks.ErrorCallback errorCallback;

        private Builder(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Builder authPath(String authPath) {
            this.authPath = authPath;
            return this;
        }

        public Builder attemptTtlSeconds(long attemptTtlSeconds) {
            this.attemptTtlSeconds = attemptTtlSeconds;
            return this;
        }

        public Builder onInvalidConfiguration(InvalidConfigurationMode mode) {
            this.onInvalidConfiguration = mode;
            return this;
        }

        public Builder provider(String id, ProviderConfig config) {
            providers.put(id, config);
            return this;
        }

        /**
         * Регистрирует trusted-провайдер под его {@link TrustedProvider#id()}.
         */
        public Builder trusted(TrustedProvider provider) {
            trustedProviders.put(provider.id(), provider);
            return this;
        }

        public Builder session(SessionConfig session) {
            this.session = session;
            return this;
        }

        public Builder onUser(PadlockCallbacks.UserCallback callback) {
            this.userCallback = callback;
            return this;
        }

        public Builder onError(PadlockCallbacks.ErrorCallback callback) {
            this.errorCallback = callback;
            return this;
        }

        public PadlockConfiguration build() {
            return new PadlockConfiguration(baseUrl, authPath, attemptTtlSeconds, onInvalidConfiguration,
                    providers, trustedProviders, session, userCallback, errorCallback);
        }
    }
}
