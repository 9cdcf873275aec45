package com.qubular.spotify;

import java.io.IOException;
import java.util.Optional;

/**
 * Persists tokens between runs, one entry per flow id.
 */
public interface TokenCache {
    /**
     * @return the cached token, or empty if there is none or it cannot be read.
     */
    Optional<Token> load(String flowId);

    void save(String flowId, Token token) throws IOException;
}
