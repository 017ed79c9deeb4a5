package cull.email.app.exception;

public class RulePersistenceException extends RetentionException {
    public RulePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
