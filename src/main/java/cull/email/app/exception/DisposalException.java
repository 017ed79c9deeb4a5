package cull.email.app.exception;

import lombok.Getter;

@Getter
public class DisposalException extends RetentionException {
    private final long ruleId;
    private final String label;
    private final int chunkIndex;
    private final int count;

    public DisposalException(long ruleId, String label, int chunkIndex, int count, Throwable cause) {
        super("Disposal failed for rule #" + ruleId + ", label `" + label + "`, chunk " + chunkIndex
            + " (" + count + " messages): " + cause.getMessage(), cause);
        this.ruleId = ruleId;
        this.label = label;
        this.chunkIndex = chunkIndex;
        this.count = count;
    }
}
