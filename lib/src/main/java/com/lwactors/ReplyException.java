package com.lwactors;

/**
 * Unchecked exception thrown by the blocking {@link Reply} API when a reply
 * carries an error that is not itself unchecked, or when the wait fails.
 */
public class ReplyException extends RuntimeException {

    private final transient Object error;

    public ReplyException(String message) {
        super(message);
        this.error = null;
    }

    public ReplyException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    /**
     * Wraps a non-throwable domain error.
     *
     * @param message the detail message
     * @param error the domain error carried by the reply
     */
    public ReplyException(String message, Object error) {
        super(message + ": " + error, error instanceof Throwable ? (Throwable) error : null);
        this.error = error;
    }

    /**
     * Returns the domain error carried by the failed reply, if any.
     *
     * @return the error value, or null when the wait itself failed
     */
    public Object getError() {
        return error;
    }
}
