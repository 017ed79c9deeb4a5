package cull.email.app.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything that happened for one label of one rule during a run.
 */
@Value
@Builder
public class LabelOutcome {
    public enum Status {
        COMPLETED,
        /** Rule has no labels, nothing was searched. */
        SKIPPED,
        FAILED,
        CANCELLED
    }

    long ruleId;
    String label;
    DisposalAction action;
    Status status;
    String query;
    int enumerated;
    @Singular
    List<ChunkOutcome> chunks;
    String error;
    String errorType;

    public int succeededCount() {
        return chunks.stream().mapToInt(chunk -> chunk.getSucceeded().size()).sum();
    }

    public int failedCount() {
        return chunks.stream().mapToInt(chunk -> chunk.getFailed().size()).sum();
    }
}
