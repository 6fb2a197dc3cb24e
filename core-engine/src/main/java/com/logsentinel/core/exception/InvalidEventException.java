package com.logsentinel.core.exception;

/**
 * A {@code ClusterEvent} is malformed (missing signature or timestamp,
 * non-positive count, or a repeated signature within one batch). Never
 * retried and never persisted.
 *
 * @since 1.0.0
 */
public class InvalidEventException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidEventException(String message) {
        super(message);
    }
}
