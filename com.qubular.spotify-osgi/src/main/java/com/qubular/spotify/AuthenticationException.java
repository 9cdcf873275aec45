package com.qubular.spotify;

/**
 * Base class for failures to obtain or keep a usable access token.
 */
public class AuthenticationException extends Exception {
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
