package com.logsentinel.core.exception;

/**
 * A history query is malformed. The message is shown to the client as-is.
 *
 * @since 1.0.0
 */
public class InvalidQueryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
