package ru.aritmos.padlock.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.padlock.provider.OAuthProviderRegistry;
import ru.aritmos.padlock.provider.ProviderModels.ProviderConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Стартовая проверка конфигурации.
 * <p>
 * Пересечение OAuth и trusted id проверяется конструктором {@link PadlockConfiguration} и фатально всегда.
 * Остальные проблемы собираются списком и обрабатываются по {@link InvalidConfigurationMode}.
 */
public final class PadlockConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(PadlockConfigurationValidator.class);

    /** минимальная длина HMAC-секрета сессии (HS256) */
    public static final int MIN_SESSION_SECRET_BYTES = 32;

    private final OAuthProviderRegistry registry;

    public PadlockConfigurationValidator(OAuthProviderRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return найденные проблемы (пусто: конфигурация корректна)
     */
    public List<String> findProblems(PadlockConfiguration configuration) {
        List<String> problems = new ArrayList<>();

        if (!isAbsoluteHttpUrl(configuration.baseUrl())) {
            problems.add("padlock.base-url должен быть абсолютным http(s) URL");
        }

        for (Map.Entry<String, ProviderConfig> e : configuration.providers().entrySet()) {
            String id = e.getKey();
            ProviderConfig cfg = e.getValue();
            if (!registry.supports(id)) {
                problems.add("Провайдер '" + id + "' не поддерживается (доступны: " + registry.ids() + ")");
            }
            if (cfg == null || isBlank(cfg.clientId())) {
                problems.add("Для провайдера '" + id + "' не задан client-id");
            }
            if (cfg == null || isBlank(cfg.clientSecret())) {
                problems.add("Для провайдера '" + id + "' не задан client-secret");
            }
        }

        SessionConfig session = configuration.session();
        if (session != null) {
            String secret = session.secret();
            if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SESSION_SECRET_BYTES) {
                problems.add("padlock.session.secret должен быть не короче " + MIN_SESSION_SECRET_BYTES + " байт");
            }
        }
        return problems;
    }

    /**
     * Проверить конфигурацию и отреагировать по режиму.
     *
     * @throws IllegalStateException в режиме ERROR при наличии проблем
     */
    public void validate(PadlockConfiguration configuration) {
        List<String> problems = findProblems(configuration);
        if (problems.isEmpty()) {
            return;
        }
        switch (configuration.onInvalidConfiguration()) {
            case SILENT -> log.debug("Конфигурация Padlock: проблем {}, режим SILENT", problems.size());
            case WARN -> problems.forEach(p -> log.warn("Конфигурация Padlock: {}", p));
            case ERROR -> throw new IllegalStateException("Некорректная конфигурация Padlock: " + String.join("; ", problems));
        }
    }

    private static boolean isAbsoluteHttpUrl(String url) {
        if (isBlank(url)) {
            return false;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            return uri.getHost() != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
