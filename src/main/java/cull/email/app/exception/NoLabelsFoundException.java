package cull.email.app.exception;

public class NoLabelsFoundException extends RetentionException {
    public NoLabelsFoundException() {
        super("No labels found in mailbox");
    }
}
