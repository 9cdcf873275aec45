package com.qubular.spotify;

import java.io.IOException;
import java.net.URI;
import java.security.MessageDigest;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * One way of turning {@link Credentials} into a {@link Token} and keeping it fresh.
 * <p>
 * Implementations hold the token in a slot shared by every caller of the flow, and are safe for concurrent use.
 * They are created through their static <code>setup</code> factories, which hydrate the slot from the configured
 * {@link TokenCache}.
 */
public interface AuthFlow {
    /**
     * @return the flow identity, which also namespaces the token cache.
     */
    String getId();

    /**
     * @return the scopes this flow requests from the accounts server.
     */
    Set<String> getScopes();

    OAuthConfig getOAuthConfig();

    /**
     * @return true if obtaining a token requires the user to visit {@link #getAuthorizationUri(boolean)}.
     */
    boolean isInteractive();

    /**
     * @param showDialog force the consent dialog even if the user has already approved this client.
     * @return the consent page URI, empty if the flow has no interactive step.
     */
    Optional<URI> getAuthorizationUri(boolean showDialog);

    /**
     * Exchanges a one time authorization code for a token, stores it in the slot and persists it.
     * Non-interactive flows ignore the code and run their own exchange.
     */
    void requestAccessToken(String authCode) throws AuthenticationException, IOException;

    /**
     * Obtains a new token without user interaction, stores it in the slot and persists it.
     *
     * @throws MissingRefreshTokenException if an interactive flow holds no refresh token.
     */
    void refresh() throws AuthenticationException, IOException;

    /**
     * As {@link #refresh()}, but does nothing if the slot no longer holds <code>expired</code>. Callers that
     * observe the same expired token concurrently share a single exchange.
     */
    void refresh(Token expired) throws AuthenticationException, IOException;

    /**
     * @return the current token, which may be empty or expired.
     */
    Token getToken();

    /**
     * Replaces the token in the slot. The token is neither cached nor announced to listeners.
     */
    void setToken(Token token);

    /**
     * Completes the interactive step from the parameters of the redirect back to
     * {@link OAuthConfig#getRedirectUri()}.
     *
     * @return the newly obtained token.
     * @throws CsrfMismatchException if the <code>state</code> parameter is not the one this flow issued.
     * @throws AuthProviderException if the user or the accounts server refused authorization.
     */
    default Token completeAuthorization(Map<String, String> callbackParams) throws AuthenticationException, IOException {
        String state = callbackParams.get("state");
        if (state == null ||
                !MessageDigest.isEqual(state.getBytes(UTF_8), getOAuthConfig().getState().getBytes(UTF_8))) {
            throw new CsrfMismatchException();
        }
        String error = callbackParams.get("error");
        if (error != null) {
            throw new AuthProviderException(error, callbackParams.get("error_description"), 0);
        }
        String code = callbackParams.get("code");
        if (code == null || code.isEmpty()) {
            throw new AuthenticationException("Authorization callback carried no code");
        }
        requestAccessToken(code);
        return getToken();
    }
}
