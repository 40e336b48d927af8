package ru.aritmos.padlock.model;

import io.micronaut.core.annotation.Introspected;

/**
 * Нормализованный пользователь, независимый от провайдера.
 * <p>
 * Пара {@code (provider, providerAccountId)}: инвариантный ключ идентичности.
 * Поле {@code raw} передаётся «как есть» и ядром не интерпретируется.
 *
 * @param provider идентификатор провайдера (github, microsoft, имя trusted-провайдера)
 * @param providerAccountId стабильный идентификатор аккаунта в пространстве имён провайдера
 * @param email email или {@code null}
 * @param name отображаемое имя или {@code null}
 * @param avatar URL/data-URI аватара или {@code null}
 * @param raw исходный ответ провайдера
 */
@Introspected
public record OAuthUser(
        String provider,
        String providerAccountId,
        String email,
        String name,
        String avatar,
        Object raw
) {

    public OAuthUser withName(String newName) {
        return new OAuthUser(provider, providerAccountId, email, newName, avatar, raw);
    }
}
