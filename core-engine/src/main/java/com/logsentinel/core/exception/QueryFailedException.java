package com.logsentinel.core.exception;

/**
 * A well-formed history query could not be answered because the store failed.
 *
 * @since 1.0.0
 */
public class QueryFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public QueryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
