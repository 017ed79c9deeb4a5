package cull.email.app.exception;

import lombok.Getter;

@Getter
public class RuleNotFoundException extends RetentionException {
    private final long ruleId;

    public RuleNotFoundException(long ruleId) {
        super("Rule #" + ruleId + " not found");
        this.ruleId = ruleId;
    }
}
