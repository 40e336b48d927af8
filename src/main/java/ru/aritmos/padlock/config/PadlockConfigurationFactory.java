package ru.aritmos.padlock.config;

import io.micronaut.context.annotation.Factory;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.padlock.core.PadlockCallbacks;
import ru.aritmos.padlock.provider.OAuthProviderRegistry;
import ru.aritmos.padlock.trusted.TrustedProvider;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Сборка {@link PadlockConfiguration} из typed-настроек и bean'ов приложения.
 */
@Factory
public class PadlockConfigurationFactory {

    private static final Logger log = LoggerFactory.getLogger(PadlockConfigurationFactory.class);

    @Singleton
    public PadlockConfiguration padlockConfiguration(PadlockProperties properties,
                                                     List<ProviderProperties> providers,
                                                     @Nullable SessionProperties session,
                                                     List<TrustedProvider> trustedProviders,
                                                     @Nullable PadlockCallbacks.UserCallback userCallback,
                                                     @Nullable PadlockCallbacks.ErrorCallback errorCallback,
                                                     OAuthProviderRegistry registry) {
        PadlockConfiguration.Builder builder = PadlockConfiguration.builder(properties.getBaseUrl())
                .authPath(properties.getAuthPath())
                .attemptTtlSeconds(properties.getAttemptTtlSeconds())
                .onInvalidConfiguration(properties.getOnInvalidConfiguration())
                .onUser(userCallback)
                .onError(errorCallback);

        for (ProviderProperties p : providers) {
            builder.provider(p.getName(), p.toConfig());
        }
        Set<String> trustedIds = new HashSet<>();
        for (TrustedProvider t : trustedProviders) {
            if (!trustedIds.add(t.id())) {
                throw new IllegalStateException("Trusted-провайдер с id '" + t.id() + "' зарегистрирован повторно");
            }
            builder.trusted(t);
        }
        if (session != null) {
            builder.session(session.toConfig());
        }

        PadlockConfiguration configuration = builder.build();
        new PadlockConfigurationValidator(registry).validate(configuration);

        log.info("Padlock: baseUrl={}, authPath={}, oauth={}, trusted={}, session={}",
                configuration.baseUrl(), configuration.authPath(),
                configuration.providers().keySet(), configuration.trustedProviders().keySet(),
                configuration.session() != null);
        return configuration;
    }
}
