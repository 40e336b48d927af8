package ru.aritmos.padlock.provider;

import ru.aritmos.padlock.model.OAuthUser;

import java.util.List;

/**
 * Описание одного внешнего OAuth2-провайдера: endpoints и операции обмена кода/получения пользователя.
 * <p>
 * Реализации не хранят состояния и разделяются между запросами.
 * Важно: добавление нового провайдера не должно требовать изменений оркестратора.
 * Достаточно реализовать новый bean {@link OAuthProvider}.
 */
public interface OAuthProvider {

    /**
     * @return стабильный идентификатор провайдера (например: github, microsoft)
     */
    String id();

    /**
     * URL authorize endpoint. Может зависеть от конфигурации (например, от tenant).
     */
    String authorizeUrl(ProviderModels.ProviderConfig config);

    /**
     * URL token endpoint. Может зависеть от конфигурации (например, от tenant).
     */
    String tokenUrl(ProviderModels.ProviderConfig config);

    /**
     * Scope по умолчанию. Scope приложения добавляются после них, дубликаты допустимы.
     */
    List<String> defaultScopes();

    /**
     * Обменять код авторизации на access token (POST на token endpoint).
     *
     * @throws ProviderExchangeException при не-2xx ответе, отсутствии access_token или транспортной ошибке
     */
    ProviderModels.AccessToken exchangeCode(ProviderModels.CodeExchange exchange);

    /**
     * Получить и нормализовать пользователя.
     * <p>
     * Ошибки вторичных запросов (email, аватар) не должны приводить к ошибке всего запроса,
     * соответствующее поле становится {@code null}.
     *
     * @throws ProviderExchangeException если основной запрос профиля завершился ошибкой
     */
    OAuthUser fetchUser(String accessToken);
}
