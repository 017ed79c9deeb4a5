package cull.email.app.entity;

import lombok.Value;

/** A label as it exists in the mailbox. */
@Value
public class MailboxLabel {
    String name;
    String id;
}
