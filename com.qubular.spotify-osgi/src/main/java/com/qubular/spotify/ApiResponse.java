package com.qubular.spotify;

import java.util.Optional;

/**
 * A successful Web API response. A 204 carries no body; any other success carries a decoded one.
 */
public final class ApiResponse<T> {
    private final int status;
    private final T body;

    private ApiResponse(int status, T body) {
        this.status = status;
        this.body = body;
    }

    static <T> ApiResponse<T> noContent() {
        return new ApiResponse<>(204, null);
    }

    static <T> ApiResponse<T> of(int status, T body) {
        return new ApiResponse<>(status, body);
    }

    public int getStatus() {
        return status;
    }

    public boolean isNoContent() {
        return status == 204;
    }

    public Optional<T> getBody() {
        return Optional.ofNullable(body);
    }
}
