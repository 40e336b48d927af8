package ru.aritmos.padlock.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.padlock.model.OAuthUser;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GithubProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private GithubProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        String base = "http://localhost:" + server.getAddress().getPort();
        provider = new GithubProvider(new ProviderHttpClient(mapper),
                new GithubProvider.Endpoints(base + "/login/oauth/authorize", base + "/login/oauth/access_token", base));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void shouldExchangeCodeWithPkceVerifier() {
        AtomicReference<String> form = new AtomicReference<>();
        server.createContext("/login/oauth/access_token", exchange -> {
            form.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"access_token\":\"gho_abc\",\"token_type\":\"bearer\"}");
        });

        ProviderModels.AccessToken token = provider.exchangeCode(exchange("the-code", "the-verifier"));

        assertEquals("gho_abc", token.accessToken());
        assertTrue(form.get().contains("code=the-code"));
        assertTrue(form.get().contains("code_verifier=the-verifier"));
        assertTrue(form.get().contains("client_id=cid"));
    }

    @Test
    void shouldFailExchangeOnErrorBodyWithStatus200() {
        server.createContext("/login/oauth/access_token",
                exchange -> respond(exchange, 200, "{\"error\":\"bad_verification_code\"}"));

        ProviderExchangeException ex = assertThrows(ProviderExchangeException.class,
                () -> provider.exchangeCode(exchange("c", "v")));
        assertEquals("github", ex.providerId());
    }

    @Test
    void shouldFailExchangeOnNon2xx() {
        server.createContext("/login/oauth/access_token", exchange -> respond(exchange, 500, "{}"));

        assertThrows(ProviderExchangeException.class, () -> provider.exchangeCode(exchange("c", "v")));
    }

    @Test
    void shouldResolvePrimaryVerifiedEmailWhenProfileEmailIsNull() {
        server.createContext("/user", exchange -> respond(exchange, 200,
                "{\"id\":583231,\"login\":\"octocat\",\"name\":null,\"email\":null,\"avatar_url\":\"https://a/1.png\"}"));
        server.createContext("/user/emails", exchange -> respond(exchange, 200, "["
                + "{\"email\":\"first@example.com\",\"primary\":false,\"verified\":true},"
                + "{\"email\":\"primary-unverified@example.com\",\"primary\":true,\"verified\":false},"
                + "{\"email\":\"octo@example.com\",\"primary\":true,\"verified\":true}"
                + "]"));

        OAuthUser user = provider.fetchUser("gho_abc");

        assertEquals("github", user.provider());
        assertEquals("583231", user.providerAccountId());
        assertEquals("octo@example.com", user.email());
        assertEquals("octocat", user.name());
        assertEquals("https://a/1.png", user.avatar());
    }

    @Test
    void shouldDegradeEmailToNullWhenEmailLookupFails() {
        server.createContext("/user", exchange -> respond(exchange, 200, "{\"id\":1,\"login\":\"x\",\"email\":null}"));
        server.createContext("/user/emails", exchange -> respond(exchange, 403, "{\"message\":\"forbidden\"}"));

        OAuthUser user = provider.fetchUser("gho_abc");

        assertEquals("1", user.providerAccountId());
        assertNull(user.email());
    }

    @Test
    void shouldFailWhenPrimaryProfileFails() {
        server.createContext("/user", exchange -> respond(exchange, 401, "{\"message\":\"Bad credentials\"}"));

        assertThrows(ProviderExchangeException.class, () -> provider.fetchUser("gho_abc"));
    }

    @Test
    void selectEmailFallsBackToPrimaryThenFirst() throws Exception {
        assertEquals("p@x", GithubProvider.selectEmail(mapper.readTree(
                "[{\"email\":\"a@x\",\"primary\":false,\"verified\":true},{\"email\":\"p@x\",\"primary\":true,\"verified\":false}]")));
        assertEquals("a@x", GithubProvider.selectEmail(mapper.readTree(
                "[{\"email\":\"a@x\",\"primary\":false},{\"email\":\"b@x\",\"primary\":false}]")));
        assertNull(GithubProvider.selectEmail(mapper.readTree("[]")));
    }

    private static ProviderModels.CodeExchange exchange(String code, String verifier) {
        ProviderModels.ProviderConfig cfg = ProviderModels.ProviderConfig.of("cid", "csecret");
        return new ProviderModels.CodeExchange(code, verifier, "cid", "csecret", "http://localhost/auth/callback", cfg);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
