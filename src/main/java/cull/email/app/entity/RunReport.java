package cull.email.app.entity;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
public class RunReport {
    RunMode mode;
    List<LabelOutcome> outcomes;
    boolean cancelled;

    public RunReport(RunMode mode, List<LabelOutcome> outcomes, boolean cancelled) {
        this.mode = mode;
        this.outcomes = List.copyOf(outcomes);
        this.cancelled = cancelled;
    }

    /** Chunk outcomes in execution order. */
    public List<ChunkOutcome> chunkOutcomes() {
        List<ChunkOutcome> chunks = new ArrayList<>();
        for (LabelOutcome outcome : outcomes) {
            chunks.addAll(outcome.getChunks());
        }
        return chunks;
    }

    /** Rule ids in the order they were first visited. */
    public List<Long> ruleOrder() {
        List<Long> order = new ArrayList<>();
        for (LabelOutcome outcome : outcomes) {
            if (order.isEmpty() || !order.get(order.size() - 1).equals(outcome.getRuleId())) {
                order.add(outcome.getRuleId());
            }
        }
        return order;
    }
}
