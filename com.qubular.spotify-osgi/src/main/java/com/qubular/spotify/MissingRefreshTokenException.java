package com.qubular.spotify;

public class MissingRefreshTokenException extends AuthenticationException {
    public MissingRefreshTokenException(String flowId) {
        super("Unable to refresh " + flowId + " token: no refresh token");
    }
}
