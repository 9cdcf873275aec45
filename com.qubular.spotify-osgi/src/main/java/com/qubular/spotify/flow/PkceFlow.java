package com.qubular.spotify.flow;

import com.qubular.spotify.*;
import com.qubular.spotify.internal.TokenSlot;
import com.qubular.spotify.internal.oauth.AccessGrantResponse;
import com.qubular.spotify.internal.oauth.TokenEndpoint;
import org.eclipse.jetty.util.Fields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The authorization code grant with a PKCE verifier in place of a client secret.
 */
public class PkceFlow implements AuthFlow {
    public static final String ID = "pkce";
    private static final Logger logger = LoggerFactory.getLogger(PkceFlow.class);

    private final Credentials credentials;
    private final PkceChallenge pkce;
    private final OAuthConfig oauthConfig;
    private final SpotifyConfiguration config;
    private final TokenEndpoint tokenEndpoint;
    private final TokenSlot slot;

    private PkceFlow(Credentials credentials, OAuthConfig oauthConfig, SpotifyConfiguration config) {
        this.pkce = credentials.getPkce()
                .orElseThrow(() -> new IllegalArgumentException("PKCE flow requires PKCE credentials"));
        this.credentials = credentials;
        this.oauthConfig = oauthConfig;
        this.config = config;
        this.tokenEndpoint = new TokenEndpoint(config);
        this.slot = new TokenPersistence(ID, config).newSlot();
    }

    public static PkceFlow setup(Credentials credentials, OAuthConfig oauthConfig, SpotifyConfiguration config) {
        PkceFlow flow = new PkceFlow(credentials, oauthConfig, config);
        logger.info("Set up {} flow for client {}, cached token {}", ID, credentials.getClientId(),
                flow.getToken().isEmpty() ? "absent" : "present");
        return flow;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getScopes() {
        return oauthConfig.getScopes();
    }

    @Override
    public OAuthConfig getOAuthConfig() {
        return oauthConfig;
    }

    @Override
    public boolean isInteractive() {
        return true;
    }

    @Override
    public Optional<URI> getAuthorizationUri(boolean showDialog) {
        Map<String, String> queryParams = new LinkedHashMap<>();
        queryParams.put("response_type", "code");
        queryParams.put("client_id", credentials.getClientId());
        queryParams.put("scope", String.join(" ", oauthConfig.getScopes()));
        queryParams.put("redirect_uri", oauthConfig.getRedirectUri().toString());
        queryParams.put("state", oauthConfig.getState());
        queryParams.put("show_dialog", Boolean.toString(showDialog));
        queryParams.put("code_challenge_method", PkceChallenge.METHOD);
        queryParams.put("code_challenge", pkce.getChallenge());
        return Optional.of(URI.create(config.getAuthorizeEndpoint() + "?" +
                URIHelper.generateQueryParamsForURI(queryParams)));
    }

    @Override
    public void requestAccessToken(String authCode) throws AuthenticationException, IOException {
        Fields fields = new Fields();
        fields.put("grant_type", "authorization_code");
        fields.put("code", authCode);
        fields.put("redirect_uri", oauthConfig.getRedirectUri().toString());
        fields.put("client_id", credentials.getClientId());
        fields.put("code_verifier", pkce.getVerifier());
        AccessGrantResponse grant = tokenEndpoint.requestGrant(fields, null);
        Token token = TokenEndpoint.toToken(grant, oauthConfig.getScopes(), config.getClock().instant());
        slot.update(token);
        logger.info("Obtained {} token, expires {}", ID, token.getExpiresAt());
    }

    @Override
    public void refresh() throws AuthenticationException, IOException {
        refresh(slot.get());
    }

    @Override
    public void refresh(Token expired) throws AuthenticationException, IOException {
        slot.refresh(expired, this::exchangeRefreshToken);
    }

    private Token exchangeRefreshToken(Token current) throws AuthenticationException, IOException {
        String refreshToken = current.getRefreshToken()
                .orElseThrow(() -> new MissingRefreshTokenException(ID));
        logger.debug("Refreshing {} token", ID);
        Fields fields = new Fields();
        fields.put("grant_type", "refresh_token");
        fields.put("refresh_token", refreshToken);
        fields.put("client_id", credentials.getClientId());
        AccessGrantResponse grant = tokenEndpoint.requestGrant(fields, null);
        return TokenEndpoint.toRefreshedToken(current, grant, config.getClock().instant());
    }

    @Override
    public Token getToken() {
        return slot.get();
    }

    @Override
    public void setToken(Token token) {
        slot.set(token);
    }
}
