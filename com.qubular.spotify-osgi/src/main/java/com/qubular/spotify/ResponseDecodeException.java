package com.qubular.spotify;

import java.io.IOException;

/**
 * A response body was not valid JSON, or lacked a required field.
 */
public class ResponseDecodeException extends IOException {
    public ResponseDecodeException(String message) {
        super(message);
    }

    public ResponseDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
