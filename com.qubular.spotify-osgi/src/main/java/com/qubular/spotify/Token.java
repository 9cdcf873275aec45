package com.qubular.spotify;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An access token issued by the accounts server. Instances are immutable; a refresh produces a new Token.
 */
public final class Token {
    private static final Token EMPTY = new Token("", "", Collections.emptySet(), null, Instant.EPOCH);

    private final String accessToken;
    private final String tokenType;
    private final Set<String> scopes;
    private final String refreshToken;
    private final Instant expiresAt;

    public Token(String accessToken, String tokenType, Set<String> scopes, String refreshToken, Instant expiresAt) {
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken");
        this.tokenType = Objects.requireNonNull(tokenType, "tokenType");
        this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(scopes, "scopes")));
        this.refreshToken = refreshToken;
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    /**
     * @return The placeholder held by a flow before any exchange has completed. It is never valid.
     */
    public static Token empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return accessToken.isEmpty();
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public Set<String> getScopes() {
        return scopes;
    }

    public Optional<String> getRefreshToken() {
        return Optional.ofNullable(refreshToken);
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isValid(Instant now) {
        return !isEmpty() && now.isBefore(expiresAt);
    }

    public boolean hasScopes(Set<String> required) {
        return scopes.containsAll(required);
    }

    /**
     * Applies a refresh response. Scopes are kept; the refresh token is only replaced when the server issued a new one.
     */
    public Token refreshed(String newAccessToken, String newTokenType, String newRefreshToken, Instant newExpiresAt) {
        return new Token(newAccessToken,
                newTokenType,
                scopes,
                newRefreshToken != null ? newRefreshToken : refreshToken,
                newExpiresAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Token token = (Token) o;
        return accessToken.equals(token.accessToken) &&
                tokenType.equals(token.tokenType) &&
                scopes.equals(token.scopes) &&
                Objects.equals(refreshToken, token.refreshToken) &&
                expiresAt.equals(token.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessToken, tokenType, scopes, refreshToken, expiresAt);
    }

    @Override
    public String toString() {
        return "Token{" +
                "accessToken='" + mask(accessToken) + '\'' +
                ", tokenType='" + tokenType + '\'' +
                ", scopes=" + scopes +
                ", refreshToken='" + mask(refreshToken) + '\'' +
                ", expiresAt=" + expiresAt +
                '}';
    }

    public static String mask(String secret) {
        return secret == null ? null : "*".repeat(secret.length());
    }
}
