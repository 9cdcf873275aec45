package com.qubular.spotify;

/**
 * Error envelope returned by the Web API, <code>{"error": {"status": 429, "message": "..."}}</code>.
 */
public class SpotifyError {
    public enum ErrorType {
        /** 401, the access token was rejected. */
        INVALID_TOKEN,
        /** 403, the token lacks a scope or the user lacks the entitlement. */
        UNAUTHORIZED,
        /** 404 from a player endpoint, there is no active device. */
        NO_TARGET,
        NOT_FOUND,
        RATE_LIMITED,
        BAD_REQUEST,
        UNKNOWN
    }

    private int status;
    private String message;
    private String reason;
    private transient Long retryAfter;

    public SpotifyError() {
    }

    public SpotifyError(int status, String message, String reason, Long retryAfter) {
        this.status = status;
        this.message = message;
        this.reason = reason;
        this.retryAfter = retryAfter;
    }

    public int getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public String getReason() {
        return reason;
    }

    /**
     * @return seconds to wait before retrying, when the server sent a Retry-After header.
     */
    public Long getRetryAfter() {
        return retryAfter;
    }

    @Override
    public String toString() {
        return "SpotifyError{" +
                "status=" + status +
                ", message='" + message + '\'' +
                ", reason='" + reason + '\'' +
                ", retryAfter=" + retryAfter +
                '}';
    }
}
