package ru.aritmos.padlock.provider;

/**
 * Tenant выданного токена отсутствует или не входит в allowedTenants.
 */
public class TenantRejectedException extends ProviderExchangeException {

    private final String tenantId;

    public TenantRejectedException(String providerId, String tenantId) {
        super(providerId, "tenant not allowed");
        this.tenantId = tenantId;
    }

    /**
     * @return tenant из токена или {@code null}, если claim отсутствует
     */
    public String tenantId() {
        return tenantId;
    }
}
