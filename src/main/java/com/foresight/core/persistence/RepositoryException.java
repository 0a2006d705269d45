package com.foresight.core.persistence;

/**
 * Thrown when the analysis store cannot complete an operation.
 */
public class RepositoryException extends RuntimeException {
    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
