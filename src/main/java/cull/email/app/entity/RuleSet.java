package cull.email.app.entity;

import cull.email.app.exception.LabelNotFoundInRulesException;
import cull.email.app.exception.RuleNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rules keyed by id. Iteration is always by ascending id, which is the order
 * the processor executes them in.
 */
@Slf4j
public class RuleSet {
    public static final String DEFAULT_MARKER_PREFIX = "cull-gmail/processed/";

    private final TreeMap<Long, Rule> rules = new TreeMap<>();
    private final String markerPrefix;

    public RuleSet() {
        this(DEFAULT_MARKER_PREFIX);
    }

    public RuleSet(String markerPrefix) {
        if (markerPrefix == null || markerPrefix.isBlank()) {
            throw new IllegalArgumentException("Marker label prefix must not be empty");
        }
        this.markerPrefix = markerPrefix;
    }

    public String getMarkerPrefix() {
        return markerPrefix;
    }

    /**
     * Adds a rule under the next free id (highest id + 1, or 1 for an empty set).
     */
    public Rule addRule(RetentionPolicy retention, Collection<String> labels, DisposalAction action) {
        long id = rules.isEmpty() ? 1 : rules.lastKey() + 1;
        Rule rule = new Rule(id, retention, List.of(), action);
        if (labels != null) {
            labels.forEach(this::checkLabelIsFree);
            labels.forEach(rule::addLabel);
        }
        rules.put(id, rule);
        log.info("Added rule: {}", rule.describe());
        return rule;
    }

    /**
     * Inserts a rule with a caller assigned id.
     */
    public Rule putRule(Rule rule) {
        if (rules.containsKey(rule.getId())) {
            throw new IllegalArgumentException("Rule #" + rule.getId() + " already exists");
        }
        rule.getLabels().forEach(this::checkLabelIsFree);
        Rule stored = rule.copy();
        rules.put(stored.getId(), stored);
        return stored;
    }

    public Optional<Rule> getRule(long id) {
        return Optional.ofNullable(rules.get(id));
    }

    public Rule requireRule(long id) {
        Rule rule = rules.get(id);
        if (rule == null) {
            throw new RuleNotFoundException(id);
        }
        return rule;
    }

    public boolean contains(long id) {
        return rules.containsKey(id);
    }

    public Rule removeRule(long id) {
        Rule removed = rules.remove(id);
        if (removed == null) {
            throw new RuleNotFoundException(id);
        }
        log.info("Rule #{} has been removed", id);
        return removed;
    }

    public Rule removeRuleByLabel(String label) {
        Rule rule = rulesByLabel().get(label);
        if (rule == null) {
            throw new LabelNotFoundInRulesException(label);
        }
        rules.remove(rule.getId());
        log.info("Rule #{} containing the label `{}` has been removed", rule.getId(), label);
        return rule;
    }

    /**
     * @return true if the label was added, false if the rule already had it
     */
    public boolean addLabel(long id, String label) {
        Rule rule = requireRule(id);
        if (rule.targets(label)) {
            return false;
        }
        checkLabelIsFree(label);
        rule.addLabel(label);
        log.info("Label `{}` added to rule #{}", label, id);
        return true;
    }

    public boolean removeLabel(long id, String label) {
        Rule rule = requireRule(id);
        boolean removed = rule.removeLabel(label);
        if (removed) {
            log.info("Label `{}` removed from rule #{}", label, id);
        }
        return removed;
    }

    public void setAction(long id, DisposalAction action) {
        Rule rule = requireRule(id);
        rule.setAction(action);
        log.info("Action set to `{}` on rule #{}", action, id);
    }

    /** Rules by ascending id. */
    public List<Rule> rules() {
        return Collections.unmodifiableList(new ArrayList<>(rules.values()));
    }

    public List<String> labels() {
        List<String> labels = new ArrayList<>();
        for (Rule rule : rules.values()) {
            labels.addAll(rule.getLabels());
        }
        return labels;
    }

    public Map<String, Rule> rulesByLabel() {
        Map<String, Rule> byLabel = new LinkedHashMap<>();
        for (Rule rule : rules.values()) {
            for (String label : rule.getLabels()) {
                byLabel.put(label, rule);
            }
        }
        return byLabel;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    private void checkLabelIsFree(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label name must not be empty");
        }
        if (label.startsWith(markerPrefix)) {
            throw new IllegalArgumentException("Label `" + label + "` uses the reserved prefix `" + markerPrefix + "`");
        }
        Rule owner = rulesByLabel().get(label);
        if (owner != null) {
            throw new IllegalArgumentException("A rule already applies to label `" + label + "` (rule #" + owner.getId() + ")");
        }
    }
}
