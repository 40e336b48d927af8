package ru.aritmos.padlock.provider;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.padlock.core.SensitiveDataSanitizer;
import ru.aritmos.padlock.model.OAuthUser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GitHub OAuth App.
 * <p>
 * Если основной профиль не содержит email (email скрыт в публичном профиле), выполняется вторичный
 * запрос {@code /user/emails}. Ошибка этого запроса не валит вход: email становится {@code null}.
 */
@Singleton
public class GithubProvider implements OAuthProvider {

    public static final String ID = "github";

    private static final Logger log = LoggerFactory.getLogger(GithubProvider.class);
    private static final String GITHUB_JSON = "application/vnd.github+json";

    /**
     * Endpoints GitHub. Переопределяются в тестах.
     */
    public record Endpoints(String authorizeUrl, String tokenUrl, String apiBaseUrl) {

        public static Endpoints defaults() {
            return new Endpoints(
                    "https://github.com/login/oauth/authorize",
                    "https://github.com/login/oauth/access_token",
                    "https://api.github.com"
            );
        }
    }

    private final ProviderHttpClient http;
    private final Endpoints endpoints;

    @Inject
    public GithubProvider(ProviderHttpClient http) {
        this(http, Endpoints.defaults());
    }

    public GithubProvider(ProviderHttpClient http, Endpoints endpoints) {
        this.http = http;
        this.endpoints = endpoints;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String authorizeUrl(ProviderModels.ProviderConfig config) {
        return endpoints.authorizeUrl();
    }

    @Override
    public String tokenUrl(ProviderModels.ProviderConfig config) {
        return endpoints.tokenUrl();
    }

    @Override
    public List<String> defaultScopes() {
        return List.of("read:user", "user:email");
    }

    @Override
    public ProviderModels.AccessToken exchangeCode(ProviderModels.CodeExchange exchange) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", exchange.clientId());
        form.put("client_secret", exchange.clientSecret());
        form.put("code", exchange.code());
        form.put("redirect_uri", exchange.redirectUri());
        form.put("code_verifier", exchange.codeVerifier());

        ProviderHttpClient.JsonResponse resp = http.postForm(ID, tokenUrl(exchange.config()), form, Map.of());
        // GitHub сообщает об ошибке обмена кодом 200 + {"error": ...}, поэтому проверяем и тело.
        String oauthError = ProviderHttpClient.oauthError(resp.body());
        if (!resp.isSuccess() || oauthError != null) {
            throw new ProviderExchangeException(ID, "token endpoint вернул ошибку (HTTP " + resp.status() + ")"
                    + (oauthError == null ? "" : ": " + SensitiveDataSanitizer.sanitizeText(oauthError)));
        }
        String accessToken = ProviderHttpClient.text(resp.body(), "access_token");
        if (accessToken == null) {
            throw new ProviderExchangeException(ID, "token endpoint не вернул access_token");
        }
        return new ProviderModels.AccessToken(accessToken);
    }

    @Override
    public OAuthUser fetchUser(String accessToken) {
        ProviderHttpClient.JsonResponse resp = http.getJson(ID, endpoints.apiBaseUrl() + "/user", authHeaders(accessToken));
        if (!resp.isSuccess()) {
            throw new ProviderExchangeException(ID, "GitHub /user вернул HTTP " + resp.status());
        }
        JsonNode gh = resp.body();
        String id = ProviderHttpClient.text(gh, "id");
        if (id == null) {
            throw new ProviderExchangeException(ID, "GitHub /user не содержит id");
        }

        String email = ProviderHttpClient.text(gh, "email");
        if (email == null) {
            email = resolveEmail(accessToken);
        }

        String name = ProviderHttpClient.text(gh, "name");
        if (name == null) {
            name = ProviderHttpClient.text(gh, "login");
        }

        return new OAuthUser(ID, id, email, name, ProviderHttpClient.text(gh, "avatar_url"), gh);
    }

    private String resolveEmail(String accessToken) {
        try {
            ProviderHttpClient.JsonResponse resp = http.getJson(ID, endpoints.apiBaseUrl() + "/user/emails", authHeaders(accessToken));
            if (!resp.isSuccess()) {
                log.debug("GitHub /user/emails вернул HTTP {}: email не определён", resp.status());
                return null;
            }
            return selectEmail(resp.body());
        } catch (ProviderExchangeException e) {
            log.debug("GitHub /user/emails недоступен: email не определён: {}", SensitiveDataSanitizer.describe(e));
            return null;
        }
    }

    /**
     * Выбор email: primary+verified, иначе primary, иначе первый, иначе {@code null}.
     */
    static String selectEmail(JsonNode emails) {
        if (emails == null || !emails.isArray() || emails.isEmpty()) {
            return null;
        }
        JsonNode primary = null;
        for (JsonNode entry : emails) {
            boolean isPrimary = entry.path("primary").asBoolean(false);
            if (isPrimary && entry.path("verified").asBoolean(false)) {
                return ProviderHttpClient.text(entry, "email");
            }
            if (isPrimary && primary == null) {
                primary = entry;
            }
        }
        if (primary != null) {
            return ProviderHttpClient.text(primary, "email");
        }
        return ProviderHttpClient.text(emails.get(0), "email");
    }

    private static Map<String, String> authHeaders(String accessToken) {
        return Map.of(
                "Authorization", "Bearer " + accessToken,
                "Accept", GITHUB_JSON
        );
    }
}
