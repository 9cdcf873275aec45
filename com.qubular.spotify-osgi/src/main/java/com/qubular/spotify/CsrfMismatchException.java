package com.qubular.spotify;

public class CsrfMismatchException extends AuthenticationException {
    public CsrfMismatchException() {
        super("Authorization callback state does not match the state of this authorization attempt");
    }
}
