package cull.email.app.service;

import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.RunMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class RunOptions {
    @Builder.Default
    RunMode mode = RunMode.DRY_RUN;
    boolean skipTrash;
    boolean skipDelete;
    /** Restrict the run to these rule ids; empty means all rules. */
    @Singular
    Set<Long> ruleIds;
    @Builder.Default
    RunCancellation cancellation = new RunCancellation();

    public static RunOptions dryRun() {
        return RunOptions.builder().build();
    }

    public static RunOptions execute() {
        return RunOptions.builder().mode(RunMode.EXECUTE).build();
    }

    public boolean isSkipped(DisposalAction action) {
        return (action == DisposalAction.TRASH && skipTrash)
            || (action == DisposalAction.DELETE && skipDelete);
    }
}
