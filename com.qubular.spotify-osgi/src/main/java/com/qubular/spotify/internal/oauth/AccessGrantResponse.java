package com.qubular.spotify.internal.oauth;

public class AccessGrantResponse {
    public String accessToken;
    public String tokenType;
    public String scope;
    public Long expiresIn;
    public String refreshToken;
}
