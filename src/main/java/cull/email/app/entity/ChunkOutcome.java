package cull.email.app.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of disposing one chunk of a rule and label. A dry run only fills
 * {@code attempted}.
 */
@Value
@Builder
public class ChunkOutcome {
    long ruleId;
    String label;
    DisposalAction action;
    int chunkIndex;
    boolean dryRun;
    @Singular("attemptedId")
    List<String> attempted;
    @Singular("succeededId")
    List<String> succeeded;
    @Singular("failure")
    Map<String, String> failed;
    boolean markerApplied;
    String markerError;

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
