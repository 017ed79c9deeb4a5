package cull.email.app.repository;

import cull.email.app.entity.RuleSet;

/**
 * Durable storage for the rule set.
 */
public interface RuleRepository {
    /**
     * @return the stored rules, or an empty rule set if nothing has been saved yet
     */
    RuleSet load();

    void save(RuleSet ruleSet);
}
