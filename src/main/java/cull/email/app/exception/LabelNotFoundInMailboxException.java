package cull.email.app.exception;

import lombok.Getter;

@Getter
public class LabelNotFoundInMailboxException extends RetentionException {
    private final String label;

    public LabelNotFoundInMailboxException(String label) {
        super("Label `" + label + "` not found in mailbox");
        this.label = label;
    }
}
