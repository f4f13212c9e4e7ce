package com.name.resolution.backend;

/**
 * Runtime exception thrown when a lookup backend query fails for a reason
 * other than "no matching row".
 */
public class BackendQueryException extends RuntimeException {

    public BackendQueryException(String message) {
        super(message);
    }

    public BackendQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
