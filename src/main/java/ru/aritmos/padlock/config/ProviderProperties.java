package ru.aritmos.padlock.config;

import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;
import ru.aritmos.padlock.provider.ProviderModels;

import java.util.List;

/**
 * Настройки одного OAuth-провайдера: {@code padlock.providers.<id>.*}.
 */
@EachProperty("padlock.providers")
public class ProviderProperties {

    private final String name;

    private String clientId;
    private String clientSecret;
    private List<String> scopes = List.of();
    private String redirectUri;
    private List<String> allowedTenants = List.of();

    public ProviderProperties(@Parameter String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId == null ? null : clientId.trim();
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public List<String> getScopes() {
        return scopes;
    }

    public void setScopes(List<String> scopes) {
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public void setRedirectUri(String redirectUri) {
        this.redirectUri = redirectUri;
    }

    public List<String> getAllowedTenants() {
        return allowedTenants;
    }

    public void setAllowedTenants(List<String> allowedTenants) {
        this.allowedTenants = allowedTenants == null ? List.of() : List.copyOf(allowedTenants);
    }

    public ProviderModels.ProviderConfig toConfig() {
        return new ProviderModels.ProviderConfig(clientId, clientSecret, scopes, redirectUri, allowedTenants);
    }
}
