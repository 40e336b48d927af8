package ru.aritmos.padlock.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Post;
import io.micronaut.security.annotation.Secured;
import io.micronaut.security.rules.SecurityRule;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.padlock.core.AuthErrorCode;
import ru.aritmos.padlock.core.AuthFlowException;
import ru.aritmos.padlock.core.AuthOrchestrator;
import ru.aritmos.padlock.core.ExchangeCookieJar;
import ru.aritmos.padlock.core.SensitiveDataSanitizer;
import ru.aritmos.padlock.model.OAuthUser;
import ru.aritmos.padlock.model.SessionPayload;
import ru.aritmos.padlock.security.SessionAuthorizer;

import java.util.Map;

/**
 * HTTP-маршруты входа.
 * <p>
 * Ошибки потока отдаются как {@code {"error": <код>, "message": <текст>}} со статусом кода ошибки.
 * Изменения cookie (в т.ч. удаление cookie попытки входа) применяются и к успешному, и к ошибочному ответу.
 */
@Controller("${padlock.auth-path:/auth}")
@Secured(SecurityRule.IS_ANONYMOUS)
@Tag(name = "Аутентификация", description = "Вход через OAuth2 (PKCE) и trusted-провайдеры, проверка сессии.")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final AuthOrchestrator orchestrator;
    private final SessionAuthorizer sessionAuthorizer;

    public AuthController(AuthOrchestrator orchestrator, SessionAuthorizer sessionAuthorizer) {
        this.orchestrator = orchestrator;
        this.sessionAuthorizer = sessionAuthorizer;
    }

    @Get
    @Operation(
            summary = "Начать вход",
            description = "Для OAuth-провайдера выставляет cookie PKCE/state и перенаправляет на authorize endpoint. "
                    + "Trusted-провайдеры принимают только POST."
    )
    @ApiResponse(responseCode = "302", description = "Редирект на страницу авторизации провайдера")
    @ApiResponse(responseCode = "400", description = "Не указан или неизвестен provider")
    @ApiResponse(responseCode = "405", description = "GET к trusted-провайдеру")
    @Parameter(name = "provider", in = ParameterIn.QUERY, required = true, description = "Идентификатор провайдера")
    public HttpResponse<?> initiate(HttpRequest<?> request) {
        ExchangeCookieJar cookies = ExchangeCookieJar.from(request);
        return cookies.applyTo(run(() -> orchestrator.initiate(request, null, cookies)));
    }

    @Post(consumes = MediaType.ALL, produces = MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Вход через trusted-провайдер",
            description = "Тело {\"args\": [...]} передаётся провайдеру позиционно. Пустое или неразбираемое тело равносильно пустому списку."
    )
    @ApiResponse(responseCode = "200", description = "Пользователь; cookie сессии выставлена",
            content = @Content(schema = @Schema(implementation = OAuthUser.class)))
    @ApiResponse(responseCode = "401", description = "Провайдер отклонил учётные данные")
    @ApiResponse(responseCode = "403", description = "Origin/Referer не совпадает с base URL")
    @Parameter(name = "provider", in = ParameterIn.QUERY, required = true, description = "Идентификатор trusted-провайдера")
    public HttpResponse<?> initiatePost(HttpRequest<?> request, @Body @Nullable String body) {
        ExchangeCookieJar cookies = ExchangeCookieJar.from(request);
        return cookies.applyTo(run(() -> orchestrator.initiate(request, body, cookies)));
    }

    @Get(uri = "/callback", produces = MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Callback OAuth-провайдера",
            description = "Проверяет state, обменивает code на access token (с PKCE verifier) и загружает пользователя."
    )
    @ApiResponse(responseCode = "200", description = "Пользователь; cookie сессии выставлена",
            content = @Content(schema = @Schema(implementation = OAuthUser.class)))
    @ApiResponse(responseCode = "400", description = "Ошибка провайдера, неверный state или отсутствует PKCE")
    @ApiResponse(responseCode = "502", description = "Token endpoint/userinfo провайдера ответил ошибкой")
    public HttpResponse<?> callback(HttpRequest<?> request) {
        ExchangeCookieJar cookies = ExchangeCookieJar.from(request);
        return cookies.applyTo(run(() -> orchestrator.complete(request, cookies)));
    }

    @Get(uri = "/session", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Текущая сессия", description = "Токен берётся из Authorization: Bearer или cookie сессии.")
    @ApiResponse(responseCode = "200", description = "Payload сессии",
            content = @Content(schema = @Schema(implementation = SessionPayload.class)))
    @ApiResponse(responseCode = "401", description = "Токен отсутствует, невалиден или истёк")
    public HttpResponse<?> session(HttpRequest<?> request) {
        return run(() -> HttpResponse.ok(sessionAuthorizer.authorize(request, true)));
    }

    private MutableHttpResponse<?> run(ResponseSupplier action) {
        try {
            return action.get();
        } catch (AuthFlowException e) {
            if (e.code() == AuthErrorCode.INTERNAL || e.code() == AuthErrorCode.CONFIGURATION_ERROR) {
                log.error("Ошибка входа [{}]: {}", e.code(), SensitiveDataSanitizer.describe(e));
            } else {
                log.warn("Вход отклонён [{}]: {}", e.code(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            }
            return error(e.code(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Непредвиденная ошибка входа: {}", SensitiveDataSanitizer.describe(e), e);
            return error(AuthErrorCode.INTERNAL, "auth error");
        }
    }

    private static MutableHttpResponse<?> error(AuthErrorCode code, String message) {
        return HttpResponse.status(code.status())
                .contentType(MediaType.APPLICATION_JSON_TYPE)
                .body(Map.of(
                        "error", code.name(),
                        "message", SensitiveDataSanitizer.sanitizeText(message == null ? code.name() : message)));
    }

    @FunctionalInterface
    private interface ResponseSupplier {
        MutableHttpResponse<?> get();
    }
}
