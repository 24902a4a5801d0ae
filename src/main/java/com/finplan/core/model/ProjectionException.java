package com.finplan.core.model;

/**
 * Base type of every failure raised by the projection engine.
 */
public class ProjectionException extends RuntimeException {
    public ProjectionException(String message) {
        super(message);
    }

    public ProjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
