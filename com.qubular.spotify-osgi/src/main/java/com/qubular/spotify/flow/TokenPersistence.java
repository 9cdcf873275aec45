package com.qubular.spotify.flow;

import com.qubular.spotify.SpotifyConfiguration;
import com.qubular.spotify.Token;
import com.qubular.spotify.internal.TokenSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Loads a flow's token from the cache at setup, and writes and announces every new token.
 */
class TokenPersistence implements TokenSlot.UpdateListener {
    private static final Logger logger = LoggerFactory.getLogger(TokenPersistence.class);

    private final String flowId;
    private final SpotifyConfiguration config;

    TokenPersistence(String flowId, SpotifyConfiguration config) {
        this.flowId = flowId;
        this.config = config;
    }

    Token loadCached() {
        return config.getTokenCache()
                .flatMap(cache -> cache.load(flowId))
                .orElse(Token.empty());
    }

    TokenSlot newSlot() {
        return new TokenSlot(loadCached(), this);
    }

    @Override
    public void tokenStored(Token token) {
        config.getTokenCache().ifPresent(cache -> {
            try {
                cache.save(flowId, token);
            } catch (IOException e) {
                logger.warn("Unable to cache {} token", flowId, e);
            }
        });
        config.getTokenListener().ifPresent(listener -> {
            try {
                listener.tokenUpdated(token);
            } catch (RuntimeException e) {
                logger.warn("Token listener failed for {} token", flowId, e);
            }
        });
    }
}
