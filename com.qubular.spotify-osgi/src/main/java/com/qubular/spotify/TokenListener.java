package com.qubular.spotify;

@FunctionalInterface
public interface TokenListener {
    /**
     * Called after a flow has obtained a new token from the accounts server and stored it.
     */
    void tokenUpdated(Token token);
}
