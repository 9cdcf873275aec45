package com.qubular.spotify;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

public class TokenTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00.123456789Z");

    private static Token token(Instant expiresAt, String refreshToken) {
        return new Token("access", "Bearer", Scopes.of("a", "b"), refreshToken, expiresAt);
    }

    @Test
    public void validOnlyStrictlyBeforeExpiry() {
        Token token = token(NOW, null);
        assertTrue(token.isValid(NOW.minusNanos(1)));
        assertFalse(token.isValid(NOW));
        assertFalse(token.isValid(NOW.plusSeconds(1)));
    }

    @Test
    public void emptyTokenIsNeverValid() {
        assertTrue(Token.empty().isEmpty());
        assertFalse(Token.empty().isValid(Instant.EPOCH.minus(1, ChronoUnit.DAYS)));
        assertTrue(Token.empty().getRefreshToken().isEmpty());
    }

    @Test
    public void hasScopesRequiresEveryScope() {
        Token token = token(NOW, null);
        assertTrue(token.hasScopes(Scopes.of()));
        assertTrue(token.hasScopes(Scopes.of("a")));
        assertTrue(token.hasScopes(Scopes.of("b", "a")));
        assertFalse(token.hasScopes(Scopes.of("a", "c")));
    }

    @Test
    public void refreshKeepsScopesAndRefreshTokenWhenNoneIssued() {
        Token refreshed = token(NOW, "refresh1").refreshed("access2", "Bearer", null, NOW.plusSeconds(3600));
        assertEquals("access2", refreshed.getAccessToken());
        assertEquals(Scopes.of("a", "b"), refreshed.getScopes());
        assertEquals("refresh1", refreshed.getRefreshToken().orElseThrow());
        assertEquals(NOW.plusSeconds(3600), refreshed.getExpiresAt());
    }

    @Test
    public void refreshRotatesRefreshToken() {
        Token refreshed = token(NOW, "refresh1").refreshed("access2", "Bearer", "refresh2", NOW.plusSeconds(3600));
        assertEquals("refresh2", refreshed.getRefreshToken().orElseThrow());
    }

    @Test
    public void toStringMasksSecrets() {
        String s = new Token("secretaccess", "Bearer", Scopes.of(), "secretrefresh", NOW).toString();
        assertFalse(s.contains("secretaccess"), s);
        assertFalse(s.contains("secretrefresh"), s);
        assertTrue(s.contains("************"), s);
    }

    @Test
    public void scopesParseSpaceSeparatedList() {
        assertEquals(Scopes.of("user-read-private", "user-library-read"),
                Scopes.parse(" user-read-private  user-library-read "));
        assertTrue(Scopes.parse("").isEmpty());
        assertTrue(Scopes.parse(null).isEmpty());
    }
}
