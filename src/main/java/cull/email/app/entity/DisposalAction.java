package cull.email.app.entity;

import java.util.Locale;

public enum DisposalAction {
    /** Move to Gmail trash; Gmail purges it after 30 days. */
    TRASH("move the message to trash"),
    /** Permanent removal. */
    DELETE("delete the message");

    private final String description;

    DisposalAction(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isReversible() {
        return this == TRASH;
    }

    public static DisposalAction parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Action is required");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "trash":
                return TRASH;
            case "delete":
                return DELETE;
            default:
                throw new IllegalArgumentException("Unknown action `" + value + "`, expected trash or delete");
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
