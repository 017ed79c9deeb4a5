package cull.email.app.exception;

/**
 * Base class for errors raised while configuring or running retention rules.
 */
public class RetentionException extends RuntimeException {
    public RetentionException(String message) {
        super(message);
    }

    public RetentionException(String message, Throwable cause) {
        super(message, cause);
    }
}
