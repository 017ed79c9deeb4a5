package cull.email.app.entity;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A retention policy bound to a set of Gmail labels and a disposal action.
 * Changes go through {@link RuleSet}; the processor only reads rules.
 */
@Getter
public class Rule {
    private final long id;
    private final RetentionPolicy retention;
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> labels = new LinkedHashSet<>();
    private DisposalAction action;

    public Rule(long id, RetentionPolicy retention, Collection<String> labels, DisposalAction action) {
        if (id <= 0) {
            throw new IllegalArgumentException("Rule id must be positive, got " + id);
        }
        if (retention == null) {
            throw new IllegalArgumentException("Rule #" + id + " has no retention policy");
        }
        this.id = id;
        this.retention = retention;
        this.action = action == null ? DisposalAction.TRASH : action;
        if (labels != null) {
            for (String label : labels) {
                addLabel(label);
            }
        }
    }

    /** Labels in declared order. */
    public List<String> getLabels() {
        return List.copyOf(labels);
    }

    public boolean hasLabels() {
        return !labels.isEmpty();
    }

    public boolean targets(String label) {
        return labels.contains(label);
    }

    /**
     * Name of the label put on messages this rule disposed of.
     */
    public String markerLabel(String prefix) {
        return prefix + "rule-" + id;
    }

    public String describe() {
        MessageAge age = retention.getAge();
        return "Rule #" + id + " is active on `" + String.join(", ", labels) + "` to "
            + action.getDescription() + " if it is more than " + age.describe() + " old.";
    }

    boolean addLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label name must not be empty");
        }
        return labels.add(label);
    }

    boolean removeLabel(String label) {
        return labels.remove(label);
    }

    void setAction(DisposalAction action) {
        if (action == null) {
            throw new IllegalArgumentException("Action is required");
        }
        this.action = action;
    }

    public Rule copy() {
        return new Rule(id, retention, new ArrayList<>(labels), action);
    }

    @Override
    public String toString() {
        return describe();
    }
}
