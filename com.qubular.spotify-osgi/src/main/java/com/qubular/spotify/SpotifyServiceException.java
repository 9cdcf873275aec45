package com.qubular.spotify;

import java.io.IOException;

public class SpotifyServiceException extends IOException {
    private final SpotifyError.ErrorType errorType;
    private final SpotifyError spotifyError;

    public SpotifyServiceException(SpotifyError.ErrorType errorType, SpotifyError spotifyError) {
        super(formatErrorMessage(errorType, spotifyError));
        this.errorType = errorType;
        this.spotifyError = spotifyError;
    }

    public SpotifyError.ErrorType getErrorType() {
        return errorType;
    }

    public SpotifyError getSpotifyError() {
        return spotifyError;
    }

    public int getStatus() {
        return spotifyError.getStatus();
    }

    private static String formatErrorMessage(SpotifyError.ErrorType errorType, SpotifyError spotifyError) {
        String msg = String.format("API returned %d:%s - %s", spotifyError.getStatus(), errorType, spotifyError.getMessage());
        if (spotifyError.getReason() != null) {
            msg += " - " + spotifyError.getReason();
        }
        if (spotifyError.getRetryAfter() != null) {
            msg += String.format(" (retry after %ds)", spotifyError.getRetryAfter());
        }
        return msg;
    }
}
