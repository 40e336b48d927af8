package ru.aritmos.padlock.provider;

import java.util.List;

/**
 * Модели слоя OAuth-провайдеров.
 * <p>
 * Все модели неизменяемые и безопасны для совместного использования между запросами.
 */
public final class ProviderModels {

    private ProviderModels() {
    }

    /**
     * Настройки приложения для одного провайдера.
     * <p>
     * Секреты не логируются: {@link #toString()} маскирует {@code clientSecret}.
     *
     * @param clientId идентификатор клиента
     * @param clientSecret секрет клиента
     * @param scopes дополнительные scope (добавляются после scope провайдера по умолчанию)
     * @param redirectUri переопределение redirect URI, либо {@code null}
     * @param allowedTenants допустимые tenant (только для multi-tenant провайдеров)
     */
    public record ProviderConfig(
            String clientId,
            String clientSecret,
            List<String> scopes,
            String redirectUri,
            List<String> allowedTenants
    ) {

        public ProviderConfig {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
            allowedTenants = allowedTenants == null
                    ? List.of()
                    : allowedTenants.stream().filter(t -> t != null && !t.isBlank()).map(String::trim).toList();
            redirectUri = (redirectUri == null || redirectUri.isBlank()) ? null : redirectUri.trim();
        }

        public static ProviderConfig of(String clientId, String clientSecret) {
            return new ProviderConfig(clientId, clientSecret, List.of(), null, List.of());
        }

        public ProviderConfig withScopes(List<String> newScopes) {
            return new ProviderConfig(clientId, clientSecret, newScopes, redirectUri, allowedTenants);
        }

        public ProviderConfig withAllowedTenants(List<String> tenants) {
            return new ProviderConfig(clientId, clientSecret, scopes, redirectUri, tenants);
        }

        public ProviderConfig withRedirectUri(String uri) {
            return new ProviderConfig(clientId, clientSecret, scopes, uri, allowedTenants);
        }

        @Override
        public String toString() {
            return "ProviderConfig[clientId=" + clientId
                    + ", clientSecret=***"
                    + ", scopes=" + scopes
                    + ", redirectUri=" + redirectUri
                    + ", allowedTenants=" + allowedTenants + "]";
        }
    }

    /**
     * Параметры обмена кода авторизации на access token.
     */
    public record CodeExchange(
            String code,
            String codeVerifier,
            String clientId,
            String clientSecret,
            String redirectUri,
            ProviderConfig config
    ) {

        @Override
        public String toString() {
            return "CodeExchange[clientId=" + clientId + ", redirectUri=" + redirectUri + "]";
        }
    }

    /**
     * Результат обмена кода.
     */
    public record AccessToken(String accessToken) {

        @Override
        public String toString() {
            return "AccessToken[***]";
        }
    }
}
