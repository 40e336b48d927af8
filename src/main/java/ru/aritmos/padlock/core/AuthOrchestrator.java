package ru.aritmos.padlock.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpMethod;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.MutableHttpResponse;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.padlock.config.PadlockConfiguration;
import ru.aritmos.padlock.config.SessionConfig;
import ru.aritmos.padlock.model.OAuthUser;
import ru.aritmos.padlock.model.SessionPayload;
import ru.aritmos.padlock.provider.OAuthProvider;
import ru.aritmos.padlock.provider.OAuthProviderRegistry;
import ru.aritmos.padlock.provider.ProviderExchangeException;
import ru.aritmos.padlock.provider.ProviderModels.AccessToken;
import ru.aritmos.padlock.provider.ProviderModels.CodeExchange;
import ru.aritmos.padlock.provider.ProviderModels.ProviderConfig;
import ru.aritmos.padlock.security.OriginGuard;
import ru.aritmos.padlock.security.PkceGenerator;
import ru.aritmos.padlock.security.SessionTokenCodec;
import ru.aritmos.padlock.security.StateBinder;
import ru.aritmos.padlock.trusted.TrustedArguments;
import ru.aritmos.padlock.trusted.TrustedProvider;
import ru.aritmos.padlock.trusted.TrustedProviderDispatcher;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Оркестратор входа: {@code Idle → Redirected(provider) → Completed | Failed}.
 * <p>
 * Две точки входа:
 * <ul>
 *   <li>{@link #initiate}: редирект на authorize endpoint OAuth-провайдера (PKCE + state)
 *   либо синхронная аутентификация trusted-провайдером по POST;</li>
 *   <li>{@link #complete}: обработка callback: проверка state, обмен кода, загрузка пользователя.</li>
 * </ul>
 * Оба пути заканчиваются общей пост-обработкой: хук пользователя, cookie сессии, JSON с пользователем.
 * <p>
 * Повторов нет: неуспешная попытка терминальна, новая попытка начинается с {@code initiate}.
 * Ошибки сообщаются через {@link AuthFlowException}; cookie применяются вызывающим к любому итоговому ответу.
 */
@Singleton
public class AuthOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AuthOrchestrator.class);

    private final PadlockConfiguration configuration;
    private final OAuthProviderRegistry registry;
    private final PkceGenerator pkceGenerator;
    private final StateBinder stateBinder;
    private final OriginGuard originGuard;
    private final TrustedProviderDispatcher trustedDispatcher;
    private final SessionTokenCodec tokenCodec;
    private final ObjectMapper objectMapper;

    public AuthOrchestrator(PadlockConfiguration configuration,
                            OAuthProviderRegistry registry,
                            PkceGenerator pkceGenerator,
                            StateBinder stateBinder,
                            OriginGuard originGuard,
                            TrustedProviderDispatcher trustedDispatcher,
                            SessionTokenCodec tokenCodec,
                            ObjectMapper objectMapper) {
        this.configuration = configuration;
        this.registry = registry;
        this.pkceGenerator = pkceGenerator;
        this.stateBinder = stateBinder;
        this.originGuard = originGuard;
        this.trustedDispatcher = trustedDispatcher;
        this.tokenCodec = tokenCodec;
        this.objectMapper = objectMapper;
    }

    /**
     * Начать вход.
     *
     * @param request входящий запрос (параметр {@code provider} обязателен)
     * @param body тело запроса; используется только trusted-путём, может быть {@code null}
     * @param cookies cookie текущего обмена
     * @return 302 на authorize endpoint (OAuth) или 200 с JSON пользователя (trusted)
     */
    public MutableHttpResponse<?> initiate(HttpRequest<?> request, String body, CookieJar cookies) {
        String providerId = param(request, "provider");
        if (providerId == null) {
            throw AuthFlowException.badRequest("missing provider");
        }

        ProviderConfig providerConfig = configuration.providers().get(providerId);
        if (providerConfig != null) {
            return redirectToProvider(providerId, providerConfig, cookies);
        }

        TrustedProvider trusted = configuration.trustedProviders().get(providerId);
        if (trusted != null) {
            return authenticateTrusted(providerId, trusted, request, body, cookies);
        }

        throw new AuthFlowException(AuthErrorCode.UNKNOWN_PROVIDER, "unknown provider");
    }

    /**
     * Завершить OAuth-вход по callback-запросу провайдера.
     * <p>
     * Обе cookie попытки входа удаляются сразу после чтения, до проверки state и независимо от её исхода.
     * Хук ошибок вызывается на любом неуспехе; ошибки без явного статуса превращаются в INTERNAL.
     */
    public MutableHttpResponse<?> complete(HttpRequest<?> request, CookieJar cookies) {
        try {
            return doComplete(request, cookies);
        } catch (AuthFlowException e) {
            notifyError(e);
            log.warn("Callback отклонён ({}): {}", e.code(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            throw e;
        } catch (ProviderExchangeException e) {
            notifyError(e);
            log.warn("Обмен с провайдером '{}' завершился ошибкой: {}", e.providerId(), SensitiveDataSanitizer.describe(e));
            throw new AuthFlowException(AuthErrorCode.UPSTREAM_EXCHANGE_FAILED, e.getMessage(), e);
        } catch (RuntimeException e) {
            notifyError(e);
            log.error("Непредвиденная ошибка завершения входа: {}", SensitiveDataSanitizer.describe(e), e);
            throw new AuthFlowException(AuthErrorCode.INTERNAL, "auth error", e);
        }
    }

    private MutableHttpResponse<?> doComplete(HttpRequest<?> request, CookieJar cookies) {
        String wire = param(request, "state");
        Optional<StateBinder.WireState> parsed = stateBinder.tryParse(wire);
        Optional<OAuthProvider> stateProvider = parsed.flatMap(s -> registry.find(s.provider()));

        // cookie попытки удаляются при любом исходе, в том числе при error-редиректе провайдера
        String expectedState = null;
        String verifier = null;
        if (stateProvider.isPresent()) {
            String providerId = parsed.get().provider();
            expectedState = cookies.get(LoginAttemptCookies.state(providerId)).orElse(null);
            verifier = cookies.get(LoginAttemptCookies.pkce(providerId)).orElse(null);
            LoginAttemptCookies.clear(cookies, providerId, configuration.callbackPath());
        }

        String oauthError = param(request, "error");
        if (oauthError != null) {
            String description = param(request, "error_description");
            throw AuthFlowException.badRequest(description == null ? oauthError : oauthError + ": " + description);
        }

        String code = param(request, "code");
        if (code == null || wire == null) {
            throw AuthFlowException.badRequest("invalid callback");
        }

        StateBinder.WireState state = parsed.orElseThrow(() -> AuthFlowException.badRequest("invalid state"));
        String providerId = state.provider();
        OAuthProvider provider = stateProvider
                .orElseThrow(() -> new AuthFlowException(AuthErrorCode.UNKNOWN_PROVIDER, "unknown provider"));

        if (!stateBinder.matches(state, expectedState)) {
            throw AuthFlowException.badRequest("invalid state");
        }
        if (verifier == null || verifier.isEmpty()) {
            throw AuthFlowException.badRequest("missing pkce");
        }

        ProviderConfig providerConfig = configuration.providers().get(providerId);
        if (providerConfig == null) {
            throw AuthFlowException.configuration("provider not configured");
        }

        AccessToken token = provider.exchangeCode(new CodeExchange(
                code,
                verifier,
                providerConfig.clientId(),
                providerConfig.clientSecret(),
                configuration.redirectUriFor(providerConfig),
                providerConfig));
        OAuthUser user = provider.fetchUser(token.accessToken());
        return respondWithUser(user, cookies);
    }

    private MutableHttpResponse<?> redirectToProvider(String providerId, ProviderConfig providerConfig, CookieJar cookies) {
        OAuthProvider provider = registry.find(providerId)
                .orElseThrow(() -> AuthFlowException.badRequest("invalid provider"));

        CookieOptions attemptCookie = CookieOptions.ephemeral(configuration.callbackPath(), configuration.attemptTtlSeconds());
        PkceGenerator.PkcePair pkce = pkceGenerator.generate();
        cookies.set(LoginAttemptCookies.pkce(providerId), pkce.verifier(), attemptCookie);
        String wireState = stateBinder.bind(providerId, cookies, attemptCookie);

        Map<String, String> query = new LinkedHashMap<>();
        query.put("client_id", providerConfig.clientId() == null ? "" : providerConfig.clientId());
        query.put("redirect_uri", configuration.redirectUriFor(providerConfig));
        query.put("response_type", "code");
        query.put("scope", scopeOf(provider, providerConfig));
        query.put("state", wireState);
        query.put("code_challenge", pkce.challenge());
        query.put("code_challenge_method", PkceGenerator.METHOD);

        String authorizeUrl = provider.authorizeUrl(providerConfig);
        String location = authorizeUrl + (authorizeUrl.contains("?") ? "&" : "?") + encodeQuery(query);
        log.debug("Редирект на авторизацию провайдера '{}'", providerId);
        return HttpResponse.status(HttpStatus.FOUND).header(HttpHeaders.LOCATION, location);
    }

    private MutableHttpResponse<?> authenticateTrusted(String providerId,
                                                       TrustedProvider provider,
                                                       HttpRequest<?> request,
                                                       String body,
                                                       CookieJar cookies) {
        if (request.getMethod() != HttpMethod.POST) {
            throw new AuthFlowException(AuthErrorCode.METHOD_NOT_ALLOWED, "method not allowed");
        }
        originGuard.enforce(request, configuration.baseUrl());

        TrustedArguments args = trustedDispatcher.parseArguments(body);
        OAuthUser user = trustedDispatcher.authenticate(providerId, provider, args);
        return respondWithUser(user, cookies);
    }

    /**
     * Пост-обработка, общая для обоих путей: хук, cookie сессии, JSON пользователя.
     * Токен сессии в тело ответа не попадает.
     */
    MutableHttpResponse<String> respondWithUser(OAuthUser user, CookieJar cookies) {
        OAuthUser finalUser = applyUserCallback(user);

        SessionConfig session = configuration.session();
        if (session != null) {
            String token = tokenCodec.issue(SessionPayload.of(finalUser), session.secret(), session.expiresInSeconds());
            cookies.set(session.cookieName(), token, session.cookieOptions());
        }

        log.info("Вход выполнен: provider={}, accountId={}", finalUser.provider(), finalUser.providerAccountId());
        return HttpResponse.ok(toJson(finalUser)).contentType(MediaType.APPLICATION_JSON_TYPE);
    }

    private OAuthUser applyUserCallback(OAuthUser user) {
        if (configuration.userCallback() == null) {
            return user;
        }
        OAuthUser mapped = configuration.userCallback().onUser(user);
        // null из хука означает «без изменений»
        return mapped == null ? user : mapped;
    }

    /**
     * @return первое значение query-параметра или {@code null}, если параметр отсутствует или пуст
     */
    private static String param(HttpRequest<?> request, String name) {
        return request.getParameters().getFirst(name)
                .filter(v -> !v.isEmpty())
                .orElse(null);
    }

    private void notifyError(Throwable error) {
        if (configuration.errorCallback() == null) {
            return;
        }
        try {
            configuration.errorCallback().onError(error);
        } catch (RuntimeException hookError) {
            log.warn("Хук ошибок входа завершился ошибкой: {}", SensitiveDataSanitizer.describe(hookError));
        }
    }

    private String toJson(OAuthUser user) {
        try {
            return objectMapper.writeValueAsString(user);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать пользователя", e);
        }
    }

    static String scopeOf(OAuthProvider provider, ProviderConfig config) {
        List<String> scopes = new ArrayList<>(provider.defaultScopes());
        scopes.addAll(config.scopes());
        return String.join(" ", scopes);
    }

    private static String encodeQuery(Map<String, String> query) {
        return query.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
