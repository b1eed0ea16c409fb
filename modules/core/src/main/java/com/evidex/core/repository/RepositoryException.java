package com.evidex.core.repository;

/**
 * Base of the persistence failures callers are expected to handle.
 * Anything else from the database surfaces as Jdbi's own exceptions.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
