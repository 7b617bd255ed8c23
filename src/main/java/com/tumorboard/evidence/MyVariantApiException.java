package com.tumorboard.evidence;

import java.io.IOException;

/**
 * Raised when the MyVariant.info service cannot be reached or returns an error status.
 */
public class MyVariantApiException extends IOException {

    private final int statusCode;

    public MyVariantApiException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public MyVariantApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public MyVariantApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed response, or -1 for transport failures.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
