package com.converge.cloud;

/**
 * The queried resource is not present in the account. Callers probing for
 * existence treat this as an answer, not a failure.
 */
public class ResourceDoesNotExistException extends CloudClientException {

    public ResourceDoesNotExistException(String message) {
        super(message);
    }

    public ResourceDoesNotExistException(String message, Throwable cause) {
        super(message, cause);
    }
}
