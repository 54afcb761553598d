package com.converge.cloud;

/**
 * A cloud API call failed.
 */
public class CloudClientException extends RuntimeException {

    public CloudClientException(String message) {
        super(message);
    }

    public CloudClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
