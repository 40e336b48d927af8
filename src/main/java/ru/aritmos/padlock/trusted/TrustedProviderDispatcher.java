package ru.aritmos.padlock.trusted;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.padlock.core.AuthFlowException;
import ru.aritmos.padlock.core.SensitiveDataSanitizer;
import ru.aritmos.padlock.model.OAuthUser;

import java.util.List;

/**
 * Вызов trusted-провайдеров с позиционными аргументами из тела запроса.
 */
@Singleton
public class TrustedProviderDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TrustedProviderDispatcher.class);

    private final ObjectMapper objectMapper;

    public TrustedProviderDispatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Разобрать тело {@code {"args": [...]}}.
     * <p>
     * Отсутствующее, пустое или неразбираемое тело, а также {@code args}, не являющийся массивом,
     * дают пустой список аргументов: часть trusted-провайдеров аргументов не принимает.
     */
    public TrustedArguments parseArguments(String body) {
        if (body == null || body.isBlank()) {
            return TrustedArguments.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Тело запроса trusted-провайдера не является JSON: аргументов нет");
            return TrustedArguments.empty();
        }
        JsonNode args = root == null ? null : root.get("args");
        if (args == null || !args.isArray() || args.isEmpty()) {
            return TrustedArguments.empty();
        }
        List<Object> values = objectMapper.convertValue(args, new TypeReference<List<Object>>() {
        });
        return TrustedArguments.of(values);
    }

    /**
     * Выполнить аутентификацию.
     *
     * @return аутентифицированный пользователь
     * @throws AuthFlowException UNAUTHORIZED при {@code null}, failure-результате или исключении провайдера;
     *                           {@link AuthFlowException} самого провайдера пробрасывается без изменений
     */
    public OAuthUser authenticate(String providerId, TrustedProvider provider, TrustedArguments args) {
        AuthenticationResult result;
        try {
            result = provider.authenticate(args);
        } catch (AuthFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Trusted-провайдер '{}' завершился ошибкой: {}", providerId, SensitiveDataSanitizer.describe(e));
            throw AuthFlowException.unauthorized("authentication failed");
        }
        if (result == null || !result.authenticated()) {
            log.info("Trusted-провайдер '{}' отклонил вход{}", providerId,
                    result == null || result.reason() == null ? "" : ": " + SensitiveDataSanitizer.sanitizeText(result.reason()));
            throw AuthFlowException.unauthorized("authentication failed");
        }
        return result.user();
    }
}
