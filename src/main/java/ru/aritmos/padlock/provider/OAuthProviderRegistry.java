package ru.aritmos.padlock.provider;

import jakarta.inject.Singleton;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Реестр поддерживаемых OAuth-провайдеров.
 * <p>
 * Реестр формируется через DI (Micronaut) из всех bean'ов {@link OAuthProvider}.
 * Ядро не знает о конкретных провайдерах.
 */
@Singleton
public class OAuthProviderRegistry {

    private final Map<String, OAuthProvider> providers;

    public OAuthProviderRegistry(List<OAuthProvider> providers) {
        Map<String, OAuthProvider> byId = new LinkedHashMap<>();
        if (providers != null) {
            for (OAuthProvider p : providers) {
                if (p == null) {
                    continue;
                }
                OAuthProvider previous = byId.putIfAbsent(p.id(), p);
                if (previous != null) {
                    throw new IllegalStateException("Провайдер '" + p.id() + "' зарегистрирован дважды: "
                            + previous.getClass().getName() + " и " + p.getClass().getName());
                }
            }
        }
        this.providers = Collections.unmodifiableMap(byId);
    }

    public Optional<OAuthProvider> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(id));
    }

    public boolean supports(String id) {
        return id != null && providers.containsKey(id);
    }

    public Set<String> ids() {
        return providers.keySet();
    }
}
