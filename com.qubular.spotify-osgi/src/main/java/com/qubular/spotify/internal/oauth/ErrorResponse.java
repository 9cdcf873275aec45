package com.qubular.spotify.internal.oauth;

public class ErrorResponse {
    public String error;
    public String errorDescription;
}
