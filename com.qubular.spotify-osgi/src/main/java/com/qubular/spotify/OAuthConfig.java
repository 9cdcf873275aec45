package com.qubular.spotify;

import org.apache.commons.lang3.RandomStringUtils;

import java.net.URI;
import java.security.SecureRandom;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Redirect URI, requested scopes and the anti-CSRF state of a single authorization attempt.
 */
public final class OAuthConfig {
    public static final String ENV_REDIRECT_URI = "REDIRECT_URI";
    public static final int STATE_LENGTH = 43;
    private static final char[] STATE_CHARS =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-".toCharArray();
    private static final SecureRandom random = new SecureRandom();

    private final URI redirectUri;
    private final Set<String> scopes;
    private final String state;

    public OAuthConfig(URI redirectUri, Set<String> scopes) {
        this(redirectUri, scopes, generateState());
    }

    public OAuthConfig(URI redirectUri, Set<String> scopes, String state) {
        this.redirectUri = Objects.requireNonNull(redirectUri, "redirectUri");
        this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(scopes, "scopes")));
        this.state = Objects.requireNonNull(state, "state");
    }

    public static OAuthConfig fromEnvironment(Set<String> scopes) {
        return fromEnvironment(scopes, System::getenv);
    }

    public static OAuthConfig fromEnvironment(Set<String> scopes, Function<String, String> env) {
        return new OAuthConfig(URI.create(Credentials.require(env, ENV_REDIRECT_URI)), scopes);
    }

    static String generateState() {
        return RandomStringUtils.random(STATE_LENGTH, 0, STATE_CHARS.length, false, false, STATE_CHARS, random);
    }

    public URI getRedirectUri() {
        return redirectUri;
    }

    public Set<String> getScopes() {
        return scopes;
    }

    public String getState() {
        return state;
    }

    /**
     * @return a copy for a new authorization attempt, with a fresh anti-CSRF state.
     */
    public OAuthConfig newAttempt() {
        return new OAuthConfig(redirectUri, scopes);
    }

    /**
     * @return a copy requesting a different set of scopes, with a fresh anti-CSRF state.
     */
    public OAuthConfig withScopes(Set<String> newScopes) {
        return new OAuthConfig(redirectUri, newScopes);
    }

    @Override
    public String toString() {
        return "OAuthConfig{" +
                "redirectUri=" + redirectUri +
                ", scopes=" + scopes +
                '}';
    }
}
