package cull.email.app.service;

import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.RetentionPolicy;
import cull.email.app.entity.Rule;
import cull.email.app.entity.RuleSet;
import cull.email.app.entity.RunReport;
import cull.email.app.repository.RuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns the persisted rule set. Every change is saved right away; a change
 * waits for any running disposal pass and vice versa.
 */
@Slf4j
@Service
public class RuleConfigurationService {
    private final RuleRepository ruleRepository;
    private final BatchDisposalProcessor batchDisposalProcessor;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private RuleSet ruleSet;

    public RuleConfigurationService(RuleRepository ruleRepository, BatchDisposalProcessor batchDisposalProcessor) {
        this.ruleRepository = ruleRepository;
        this.batchDisposalProcessor = batchDisposalProcessor;
    }

    public List<Rule> listRules() {
        return read(rules -> rules.rules().stream().map(Rule::copy).collect(Collectors.toList()));
    }

    public Rule getRule(long id) {
        return read(rules -> rules.requireRule(id).copy());
    }

    public Rule addRule(String retention, boolean generateLabel, Collection<String> labels, DisposalAction action) {
        RetentionPolicy policy = RetentionPolicy.of(retention, generateLabel);
        return write(rules -> rules.addRule(policy, labels, action).copy());
    }

    public Rule removeRule(long id) {
        return write(rules -> rules.removeRule(id));
    }

    public Rule removeRuleByLabel(String label) {
        return write(rules -> rules.removeRuleByLabel(label));
    }

    public Rule addLabel(long id, String label) {
        return write(rules -> {
            if (!rules.addLabel(id, label)) {
                log.info("Rule #{} already applies to `{}`", id, label);
            }
            return rules.requireRule(id).copy();
        });
    }

    public Rule removeLabel(long id, String label) {
        return write(rules -> {
            if (!rules.removeLabel(id, label)) {
                log.info("Rule #{} does not apply to `{}`", id, label);
            }
            return rules.requireRule(id).copy();
        });
    }

    public Rule setAction(long id, DisposalAction action) {
        return write(rules -> {
            rules.setAction(id, action);
            return rules.requireRule(id).copy();
        });
    }

    /**
     * Runs the rules with the given options. Rule changes wait until the run ends.
     */
    public RunReport run(RunOptions options) {
        return read(rules -> batchDisposalProcessor.run(rules, options));
    }

    /**
     * Drops the cached rule set so the next call reads the file again.
     */
    public void reload() {
        lock.writeLock().lock();
        try {
            ruleSet = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Function<RuleSet, T> action) {
        lock.readLock().lock();
        if (ruleSet == null) {
            lock.readLock().unlock();
            lock.writeLock().lock();
            try {
                loadIfNeeded();
                // downgrade, keeps other changes out until the read finishes
                lock.readLock().lock();
            } finally {
                lock.writeLock().unlock();
            }
        }
        try {
            return action.apply(ruleSet);
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Function<RuleSet, T> change) {
        lock.writeLock().lock();
        try {
            loadIfNeeded();
            T result = change.apply(ruleSet);
            ruleRepository.save(ruleSet);
            return result;
        } catch (RuntimeException e) {
            // the in-memory set may hold a change that never reached disk
            ruleSet = null;
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void loadIfNeeded() {
        if (ruleSet == null) {
            ruleSet = ruleRepository.load();
            log.info("Loaded {} retention rule(s)", ruleSet.size());
        }
    }
}
