package com.qubular.spotify;

/**
 * No usable token could be obtained without user interaction. The application has to run the
 * interactive authorization again.
 */
public class ReauthenticationRequiredException extends AuthenticationException {
    public ReauthenticationRequiredException(String message) {
        super(message);
    }

    public ReauthenticationRequiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
