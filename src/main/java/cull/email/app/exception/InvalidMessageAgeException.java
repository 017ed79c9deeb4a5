package cull.email.app.exception;

import lombok.Getter;

@Getter
public class InvalidMessageAgeException extends RetentionException {
    public enum Reason {
        /** Token does not have the {@code <unit>:<count>} shape. */
        MALFORMED,
        /** Unit character is not one of d, m, y. */
        UNKNOWN_UNIT,
        /** Count is zero, negative or not a number. */
        INVALID_COUNT
    }

    private final Reason reason;

    public InvalidMessageAgeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidMessageAgeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
