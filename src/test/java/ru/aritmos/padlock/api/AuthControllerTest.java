package ru.aritmos.padlock.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Сквозные проверки маршрутов входа на поднятом Micronaut-приложении (окружение test).
 */
@MicronautTest
class AuthControllerTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    ObjectMapper objectMapper;

    @Test
    void shouldRedirectToGithubWithMergedScopes() {
        HttpResponse<?> response = client.toBlocking().exchange(HttpRequest.GET("/auth?provider=github"));

        assertEquals(HttpStatus.FOUND, response.getStatus());
        String location = response.getHeaders().get(HttpHeaders.LOCATION);
        assertTrue(location.startsWith("https://github.com/login/oauth/authorize?"));
        assertTrue(location.contains("scope=read%3Auser+user%3Aemail+repo"));
        assertTrue(location.contains("code_challenge_method=S256"));

        List<String> cookies = response.getHeaders().getAll(HttpHeaders.SET_COOKIE);
        assertTrue(cookies.stream().anyMatch(c -> c.startsWith("pkce_github=") && c.toLowerCase(Locale.ROOT).contains("httponly")));
        assertTrue(cookies.stream().anyMatch(c -> c.startsWith("oauth_state_github=") && c.contains("Path=/auth/callback")));
    }

    @Test
    void forgedStateIsRejectedAndAttemptCookiesAreExpired() throws Exception {
        String state = URLEncoder.encode("{\"provider\":\"github\",\"state\":\"forged\"}", StandardCharsets.UTF_8);
        HttpRequest<?> request = HttpRequest.GET("/auth/callback?code=abc&state=" + state)
                .header(HttpHeaders.COOKIE, "oauth_state_github=expected; pkce_github=verifier");

        HttpClientResponseException ex = assertThrows(HttpClientResponseException.class,
                () -> client.toBlocking().exchange(request, String.class));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        JsonNode body = objectMapper.readTree(ex.getResponse().getBody(String.class).orElseThrow());
        assertEquals("BAD_REQUEST", body.get("error").asText());
        assertEquals("invalid state", body.get("message").asText());

        List<String> cookies = ex.getResponse().getHeaders().getAll(HttpHeaders.SET_COOKIE);
        assertTrue(cookies.stream().anyMatch(c -> c.startsWith("pkce_github=") && c.contains("Max-Age=0")));
        assertTrue(cookies.stream().anyMatch(c -> c.startsWith("oauth_state_github=") && c.contains("Max-Age=0")));
    }

    @Test
    void trustedLoginIssuesSessionUsableAsBearerToken() throws Exception {
        HttpResponse<String> login = client.toBlocking().exchange(
                HttpRequest.POST("/auth?provider=password", "{\"args\":[\"alice\",\"s3cret\"]}")
                        .contentType(MediaType.APPLICATION_JSON_TYPE),
                String.class);

        assertEquals(HttpStatus.OK, login.getStatus());
        JsonNode user = objectMapper.readTree(login.body());
        assertEquals("alice", user.get("providerAccountId").asText());

        String sessionCookie = login.getHeaders().getAll(HttpHeaders.SET_COOKIE).stream()
                .filter(c -> c.startsWith("padlock_token="))
                .findFirst()
                .orElseThrow();
        String token = sessionCookie.substring("padlock_token=".length(), sessionCookie.indexOf(';'));
        assertFalse(login.body().contains(token));

        HttpResponse<String> session = client.toBlocking().exchange(
                HttpRequest.GET("/auth/session").header(HttpHeaders.AUTHORIZATION, "Bearer " + token),
                String.class);

        JsonNode payload = objectMapper.readTree(session.body());
        assertEquals("password:alice", payload.get("sub").asText());
        assertEquals("password", payload.get("provider").asText());
    }

    @Test
    void wrongPasswordIsUnauthorized() {
        HttpClientResponseException ex = assertThrows(HttpClientResponseException.class, () -> client.toBlocking().exchange(
                HttpRequest.POST("/auth?provider=password", "{\"args\":[\"alice\",\"nope\"]}")
                        .contentType(MediaType.APPLICATION_JSON_TYPE),
                String.class));

        assertEquals(HttpStatus.UNAUTHORIZED, ex.getStatus());
    }

    @Test
    void crossOriginTrustedLoginIsForbidden() {
        HttpClientResponseException ex = assertThrows(HttpClientResponseException.class, () -> client.toBlocking().exchange(
                HttpRequest.POST("/auth?provider=password", "{\"args\":[\"alice\",\"s3cret\"]}")
                        .contentType(MediaType.APPLICATION_JSON_TYPE)
                        .header(HttpHeaders.ORIGIN, "https://evil.example.com"),
                String.class));

        assertEquals(HttpStatus.FORBIDDEN, ex.getStatus());
    }

    @Test
    void unknownProviderAndMissingSessionAreRejected() {
        HttpClientResponseException unknown = assertThrows(HttpClientResponseException.class,
                () -> client.toBlocking().exchange(HttpRequest.GET("/auth?provider=gitlab"), String.class));
        assertEquals(HttpStatus.BAD_REQUEST, unknown.getStatus());

        HttpClientResponseException noSession = assertThrows(HttpClientResponseException.class,
                () -> client.toBlocking().exchange(HttpRequest.GET("/auth/session"), String.class));
        assertEquals(HttpStatus.UNAUTHORIZED, noSession.getStatus());
    }
}
