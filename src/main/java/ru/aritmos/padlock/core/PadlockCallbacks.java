package ru.aritmos.padlock.core;

import ru.aritmos.padlock.model.OAuthUser;

/**
 * Точки расширения приложения.
 * <p>
 * Реализации регистрируются как bean'ы; обе необязательны.
 */
public final class PadlockCallbacks {

    private PadlockCallbacks() {
    }

    /**
     * Хук после успешной аутентификации (обоих путей: OAuth и trusted).
     * <p>
     * Может переназначить/обогатить поля пользователя или сохранить его. Не должен делать redirect:
     * cookie сессии устанавливается следующим шагом.
     */
    @FunctionalInterface
    public interface UserCallback {
        OAuthUser onUser(OAuthUser user);
    }

    /**
     * Хук ошибок завершения входа. Вызывается по принципу fire-and-forget:
     * его собственные ошибки логируются и на ответ не влияют.
     */
    @FunctionalInterface
    public interface ErrorCallback {
        void onError(Throwable error);
    }
}
