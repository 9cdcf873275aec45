package com.qubular.spotify;

/**
 * The accounts server rejected a token request with an OAuth error response.
 */
public class AuthProviderException extends AuthenticationException {
    public static final String ACCESS_DENIED = "access_denied";
    public static final String INVALID_CLIENT = "invalid_client";
    public static final String INVALID_GRANT = "invalid_grant";
    public static final String INVALID_REQUEST = "invalid_request";
    public static final String UNSUPPORTED_GRANT_TYPE = "unsupported_grant_type";

    private final String error;
    private final String errorDescription;
    private final int status;

    public AuthProviderException(String error, String errorDescription, int status) {
        super(String.format("Accounts server returned %d, %s: %s", status, error, errorDescription));
        this.error = error;
        this.errorDescription = errorDescription;
        this.status = status;
    }

    public String getError() {
        return error;
    }

    public String getErrorDescription() {
        return errorDescription;
    }

    /**
     * @return the HTTP status of the token response, or 0 if the error arrived on the redirect callback.
     */
    public int getStatus() {
        return status;
    }
}
