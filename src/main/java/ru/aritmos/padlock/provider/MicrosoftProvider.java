package ru.aritmos.padlock.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTParser;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.padlock.core.SensitiveDataSanitizer;
import ru.aritmos.padlock.model.OAuthUser;

import java.text.ParseException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Microsoft identity platform (Entra ID, v2.0 endpoints) + Microsoft Graph.
 * <p>
 * Политика tenant:
 * <ul>
 *   <li>ровно один allowedTenant: authorize/token endpoints привязаны к этому tenant;</li>
 *   <li>ноль или несколько: используется {@code common}, а после обмена кода claim {@code tid}
 *   access token проверяется по списку (если список не пуст).</li>
 * </ul>
 */
@Singleton
public class MicrosoftProvider implements OAuthProvider {

    public static final String ID = "microsoft";

    private static final Logger log = LoggerFactory.getLogger(MicrosoftProvider.class);
    private static final String COMMON_TENANT = "common";

    public record Endpoints(String loginBaseUrl, String graphBaseUrl) {

        public static Endpoints defaults() {
            return new Endpoints("https://login.microsoftonline.com", "https://graph.microsoft.com/v1.0");
        }
    }

    private final ProviderHttpClient http;
    private final Endpoints endpoints;

    @Inject
    public MicrosoftProvider(ProviderHttpClient http) {
        this(http, Endpoints.defaults());
    }

    public MicrosoftProvider(ProviderHttpClient http, Endpoints endpoints) {
        this.http = http;
        this.endpoints = endpoints;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String authorizeUrl(ProviderModels.ProviderConfig config) {
        return endpoints.loginBaseUrl() + "/" + tenantSegment(config) + "/oauth2/v2.0/authorize";
    }

    @Override
    public String tokenUrl(ProviderModels.ProviderConfig config) {
        return endpoints.loginBaseUrl() + "/" + tenantSegment(config) + "/oauth2/v2.0/token";
    }

    @Override
    public List<String> defaultScopes() {
        return List.of("openid", "profile", "email", "User.Read");
    }

    @Override
    public ProviderModels.AccessToken exchangeCode(ProviderModels.CodeExchange exchange) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", exchange.clientId());
        form.put("client_secret", exchange.clientSecret());
        form.put("grant_type", "authorization_code");
        form.put("code", exchange.code());
        form.put("redirect_uri", exchange.redirectUri());
        form.put("code_verifier", exchange.codeVerifier());

        ProviderHttpClient.JsonResponse resp = http.postForm(ID, tokenUrl(exchange.config()), form, Map.of());
        if (!resp.isSuccess()) {
            String oauthError = ProviderHttpClient.oauthError(resp.body());
            throw new ProviderExchangeException(ID, "token endpoint вернул HTTP " + resp.status()
                    + (oauthError == null ? "" : ": " + SensitiveDataSanitizer.sanitizeText(oauthError)));
        }
        String accessToken = ProviderHttpClient.text(resp.body(), "access_token");
        if (accessToken == null) {
            throw new ProviderExchangeException(ID, "token endpoint не вернул access_token");
        }

        List<String> allowedTenants = exchange.config() == null ? List.of() : exchange.config().allowedTenants();
        if (!allowedTenants.isEmpty()) {
            String tenantId = tenantOf(accessToken);
            if (tenantId == null || !allowedTenants.contains(tenantId)) {
                throw new TenantRejectedException(ID, tenantId);
            }
        }
        return new ProviderModels.AccessToken(accessToken);
    }

    @Override
    public OAuthUser fetchUser(String accessToken) {
        ProviderHttpClient.JsonResponse resp = http.getJson(ID,
                endpoints.graphBaseUrl() + "/me?$select=id,displayName,mail,userPrincipalName",
                Map.of("Authorization", "Bearer " + accessToken));
        if (!resp.isSuccess()) {
            throw new ProviderExchangeException(ID, "Graph /me вернул HTTP " + resp.status());
        }
        JsonNode ms = resp.body();
        String id = ProviderHttpClient.text(ms, "id");
        if (id == null) {
            throw new ProviderExchangeException(ID, "Graph /me не содержит id");
        }

        String email = ProviderHttpClient.text(ms, "mail");
        if (email == null) {
            email = ProviderHttpClient.text(ms, "userPrincipalName");
        }

        return new OAuthUser(ID, id, email, ProviderHttpClient.text(ms, "displayName"), fetchAvatar(accessToken), ms);
    }

    private String fetchAvatar(String accessToken) {
        try {
            ProviderHttpClient.BinaryResponse photo = http.getBytes(ID,
                    endpoints.graphBaseUrl() + "/me/photo/$value",
                    Map.of("Authorization", "Bearer " + accessToken));
            if (!photo.isSuccess() || photo.body() == null || photo.body().length == 0) {
                // 404: у пользователя нет фото, это нормальная ситуация.
                return null;
            }
            return "data:" + photo.contentType() + ";base64," + Base64.getEncoder().encodeToString(photo.body());
        } catch (ProviderExchangeException e) {
            log.debug("Не удалось получить фото пользователя Microsoft: {}", SensitiveDataSanitizer.describe(e));
            return null;
        }
    }

    static String tenantSegment(ProviderModels.ProviderConfig config) {
        List<String> tenants = config == null ? List.of() : config.allowedTenants();
        return tenants.size() == 1 ? tenants.get(0) : COMMON_TENANT;
    }

    /**
     * Claim {@code tid} access token. Подпись не проверяется: токен только что получен
     * напрямую от token endpoint по TLS.
     */
    static String tenantOf(String accessToken) {
        try {
            JWT jwt = JWTParser.parse(accessToken);
            return jwt.getJWTClaimsSet().getStringClaim("tid");
        } catch (ParseException e) {
            log.debug("Access token Microsoft не является JWT, tid не определён");
            return null;
        }
    }
}
