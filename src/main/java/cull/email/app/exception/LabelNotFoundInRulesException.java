package cull.email.app.exception;

import lombok.Getter;

@Getter
public class LabelNotFoundInRulesException extends RetentionException {
    private final String label;

    public LabelNotFoundInRulesException(String label) {
        super("No rule applies to label `" + label + "`");
        this.label = label;
    }
}
