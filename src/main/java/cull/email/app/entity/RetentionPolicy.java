package cull.email.app.entity;

import lombok.NonNull;
import lombok.Value;

/**
 * How old a message has to be before its rule applies, and whether disposed
 * messages get the rule's marker label so later runs skip them.
 */
@Value
public class RetentionPolicy {
    @NonNull
    MessageAge age;
    boolean generateLabel;

    public static RetentionPolicy of(String ageToken, boolean generateLabel) {
        return new RetentionPolicy(MessageAge.parse(ageToken), generateLabel);
    }
}
