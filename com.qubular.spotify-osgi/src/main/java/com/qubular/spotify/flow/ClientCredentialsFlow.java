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
import java.util.Optional;
import java.util.Set;

/**
 * The client credentials grant. There is no user and no refresh token; every refresh is a new exchange.
 */
public class ClientCredentialsFlow implements AuthFlow {
    public static final String ID = "creds";
    private static final Logger logger = LoggerFactory.getLogger(ClientCredentialsFlow.class);

    private final Credentials credentials;
    private final OAuthConfig oauthConfig;
    private final SpotifyConfiguration config;
    private final TokenEndpoint tokenEndpoint;
    private final TokenSlot slot;

    private ClientCredentialsFlow(Credentials credentials, OAuthConfig oauthConfig, SpotifyConfiguration config) {
        if (credentials.getClientSecret().isEmpty()) {
            throw new IllegalArgumentException("Client credentials flow requires a client secret");
        }
        this.credentials = credentials;
        this.oauthConfig = oauthConfig;
        this.config = config;
        this.tokenEndpoint = new TokenEndpoint(config);
        this.slot = new TokenPersistence(ID, config).newSlot();
    }

    /**
     * Sets up the flow, and exchanges the credentials straight away unless the cache holds a token covering the
     * requested scopes.
     */
    public static ClientCredentialsFlow setup(Credentials credentials, OAuthConfig oauthConfig, SpotifyConfiguration config)
            throws AuthenticationException, IOException {
        ClientCredentialsFlow flow = new ClientCredentialsFlow(credentials, oauthConfig, config);
        Token cached = flow.getToken();
        if (cached.isEmpty() || !cached.hasScopes(flow.getScopes())) {
            logger.debug("No usable cached {} token, requesting one", ID);
            flow.requestAccessToken("");
        }
        logger.info("Set up {} flow for client {}", ID, credentials.getClientId());
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
        return false;
    }

    @Override
    public Optional<URI> getAuthorizationUri(boolean showDialog) {
        return Optional.empty();
    }

    /**
     * Exchanges the client credentials for a token. The authorization code is ignored.
     */
    @Override
    public void requestAccessToken(String authCode) throws AuthenticationException, IOException {
        Token token = exchangeCredentials(slot.get());
        slot.update(token);
        logger.info("Obtained {} token, expires {}", ID, token.getExpiresAt());
    }

    @Override
    public void refresh() throws AuthenticationException, IOException {
        refresh(slot.get());
    }

    @Override
    public void refresh(Token expired) throws AuthenticationException, IOException {
        slot.refresh(expired, this::exchangeCredentials);
    }

    private Token exchangeCredentials(Token current) throws AuthenticationException, IOException {
        Fields fields = new Fields();
        fields.put("grant_type", "client_credentials");
        if (!oauthConfig.getScopes().isEmpty()) {
            fields.put("scope", String.join(" ", oauthConfig.getScopes()));
        }
        AccessGrantResponse grant = tokenEndpoint.requestGrant(fields, credentials);
        return TokenEndpoint.toToken(grant, oauthConfig.getScopes(), config.getClock().instant());
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
