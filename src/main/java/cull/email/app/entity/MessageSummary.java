package cull.email.app.entity;

import lombok.Value;

/**
 * Id, date and subject of a message, read from its metadata headers.
 */
@Value
public class MessageSummary {
    String id;
    String date;
    String subject;

    /** "date: subject", with placeholders for missing headers. */
    public String describe() {
        return (date != null ? date : "*** no date ***") + ": " + (subject != null ? subject : "*** no subject ***");
    }
}
