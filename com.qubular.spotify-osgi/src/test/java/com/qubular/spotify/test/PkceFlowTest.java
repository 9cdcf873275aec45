package com.qubular.spotify.test;

import com.qubular.spotify.*;
import com.qubular.spotify.flow.PkceFlow;
import com.qubular.spotify.internal.tokencache.FileTokenCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.qubular.spotify.Scopes.USER_LIBRARY_READ;
import static com.qubular.spotify.Scopes.USER_READ_PRIVATE;
import static org.junit.jupiter.api.Assertions.*;

public class PkceFlowTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final URI REDIRECT_URI = URI.create("http://localhost:8888/callback");

    @TempDir
    Path tempDir;

    private TestServer server;
    private SimpleHttpClientProvider httpClientProvider;
    private SimpleConfiguration configuration;
    private FileTokenCache tokenCache;
    private Credentials credentials;
    private OAuthConfig oauthConfig;

    private final AtomicInteger tokenRequests = new AtomicInteger();
    private final AtomicReference<Map<String, String>> lastForm = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    @BeforeEach
    public void setUp() throws Exception {
        server = new TestServer();
        httpClientProvider = new SimpleHttpClientProvider();
        tokenCache = new FileTokenCache(tempDir);
        configuration = new SimpleConfiguration();
        configuration.setAccountsServerURI(server.getBaseURI().toString());
        configuration.setHttpClientProvider(httpClientProvider);
        configuration.setTokenCache(tokenCache);
        configuration.setClock(Clock.fixed(NOW, ZoneOffset.UTC));
        credentials = Credentials.withPkce("myClientId");
        oauthConfig = new OAuthConfig(REDIRECT_URI, Scopes.of(USER_READ_PRIVATE, USER_LIBRARY_READ));
    }

    @AfterEach
    public void tearDown() throws Exception {
        httpClientProvider.close();
        server.close();
    }

    private void registerTokenEndpoint(int status, String json) {
        server.registerServlet("/api/token", new SimpleAccessServer((req, resp) -> {
            tokenRequests.incrementAndGet();
            Map<String, String> form = new HashMap<>();
            req.getParameterMap().forEach((k, v) -> form.put(k, v[0]));
            lastForm.set(form);
            lastAuthorization.set(req.getHeader("Authorization"));
            SimpleAccessServer.respond(resp, status, json);
        }));
    }

    @Test
    public void freshLoginObtainsAndCachesToken() throws Exception {
        registerTokenEndpoint(200, "{\"access_token\":\"BQD-access\",\"token_type\":\"Bearer\"," +
                "\"scope\":\"user-read-private user-library-read\",\"expires_in\":3600,\"refresh_token\":\"AQD-refresh\"}");
        PkceFlow flow = PkceFlow.setup(credentials, oauthConfig, configuration);
        assertTrue(flow.getToken().isEmpty());
        assertTrue(flow.isInteractive());
        assertEquals("pkce", flow.getId());

        URI authorizationUri = flow.getAuthorizationUri(false).orElseThrow();
        assertEquals("/authorize", authorizationUri.getPath());
        Map<String, String> query = URIHelper.getQueryParams(authorizationUri);
        assertEquals("code", query.get("response_type"));
        assertEquals("myClientId", query.get("client_id"));
        assertEquals(oauthConfig.getState(), query.get("state"));
        assertEquals(REDIRECT_URI.toString(), query.get("redirect_uri"));
        assertEquals("user-read-private user-library-read", query.get("scope"));
        assertEquals("false", query.get("show_dialog"));
        assertEquals("S256", query.get("code_challenge_method"));
        assertEquals(credentials.getPkce().orElseThrow().getChallenge(), query.get("code_challenge"));
        assertFalse(query.containsKey("client_secret"));

        Token token = flow.completeAuthorization(Map.of("code", "AQA-code", "state", oauthConfig.getState()));

        assertEquals("BQD-access", token.getAccessToken());
        assertEquals(NOW.plusSeconds(3600), token.getExpiresAt());
        assertEquals(Scopes.of(USER_READ_PRIVATE, USER_LIBRARY_READ), token.getScopes());
        assertEquals(token, flow.getToken());
        assertTrue(Files.exists(tempDir.resolve("spotify.pkce.token")));
        assertEquals(token, tokenCache.load("pkce").orElseThrow());

        Map<String, String> form = lastForm.get();
        assertNull(lastAuthorization.get());
        assertEquals("authorization_code", form.get("grant_type"));
        assertEquals("AQA-code", form.get("code"));
        assertEquals(REDIRECT_URI.toString(), form.get("redirect_uri"));
        assertEquals("myClientId", form.get("client_id"));
        assertEquals(credentials.getPkce().orElseThrow().getVerifier(), form.get("code_verifier"));
        assertFalse(form.containsKey("client_secret"));
    }

    @Test
    public void csrfMismatchNeverReachesTokenEndpoint() throws Exception {
        registerTokenEndpoint(200, "{}");
        PkceFlow flow = PkceFlow.setup(credentials, oauthConfig, configuration);

        assertThrows(CsrfMismatchException.class,
                () -> flow.completeAuthorization(Map.of("code", "AQA-code", "state", "forged")));
        assertThrows(CsrfMismatchException.class,
                () -> flow.completeAuthorization(Map.of("code", "AQA-code")));
        assertEquals(0, tokenRequests.get());
        assertTrue(flow.getToken().isEmpty());
    }

    @Test
    public void deniedAuthorizationIsProviderError() throws Exception {
        PkceFlow flow = PkceFlow.setup(credentials, oauthConfig, configuration);
        AuthProviderException e = assertThrows(AuthProviderException.class,
                () -> flow.completeAuthorization(Map.of("error", "access_denied", "state", oauthConfig.getState())));
        assertEquals(AuthProviderException.ACCESS_DENIED, e.getError());
        assertEquals(0, tokenRequests.get());
    }

    @Test
    public void refreshWithoutRefreshTokenFails() throws Exception {
        registerTokenEndpoint(200, "{}");
        PkceFlow flow = PkceFlow.setup(credentials, oauthConfig, configuration);
        flow.setToken(new Token("access", "Bearer", oauthConfig.getScopes(), null, NOW.minusSeconds(1)));

        assertThrows(MissingRefreshTokenException.class, flow::refresh);
        assertEquals(0, tokenRequests.get());
    }

    @Test
    public void refreshSendsClientIdInsteadOfSecret() throws Exception {
        registerTokenEndpoint(200, "{\"access_token\":\"BQD-new\",\"token_type\":\"Bearer\",\"expires_in\":3600," +
                "\"refresh_token\":\"AQD-rotated\"}");
        PkceFlow flow = PkceFlow.setup(credentials, oauthConfig, configuration);
        flow.setToken(new Token("BQD-old", "Bearer", oauthConfig.getScopes(), "AQD-refresh", NOW.minusSeconds(1)));

        flow.refresh();

        Map<String, String> form = lastForm.get();
        assertNull(lastAuthorization.get());
        assertEquals("refresh_token", form.get("grant_type"));
        assertEquals("AQD-refresh", form.get("refresh_token"));
        assertEquals("myClientId", form.get("client_id"));
        assertEquals("BQD-new", flow.getToken().getAccessToken());
        assertEquals("AQD-rotated", flow.getToken().getRefreshToken().orElseThrow());
        assertEquals(oauthConfig.getScopes(), flow.getToken().getScopes());
        assertEquals(flow.getToken(), tokenCache.load("pkce").orElseThrow());
    }

    @Test
    public void setupHydratesFromCache() throws Exception {
        Token cached = new Token("BQD-cached", "Bearer", oauthConfig.getScopes(), "AQD-refresh", NOW.plusSeconds(100));
        tokenCache.save("pkce", cached);
        tokenCache.save("auth-code", new Token("other", "Bearer", Scopes.of(), null, NOW.plusSeconds(100)));

        PkceFlow flow = PkceFlow.setup(credentials, oauthConfig, configuration);
        assertEquals(cached, flow.getToken());
    }

    @Test
    public void corruptCacheFallsBackToEmptyToken() throws Exception {
        Files.writeString(tempDir.resolve("spotify.pkce.token"), "garbage");
        PkceFlow flow = PkceFlow.setup(credentials, oauthConfig, configuration);
        assertTrue(flow.getToken().isEmpty());
    }

    @Test
    public void setupRejectsSecretCredentials() {
        assertThrows(IllegalArgumentException.class,
                () -> PkceFlow.setup(Credentials.withSecret("id", "secret"), oauthConfig, configuration));
    }
}
