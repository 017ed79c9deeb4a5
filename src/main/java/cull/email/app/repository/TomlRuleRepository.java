package cull.email.app.repository;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import cull.email.app.config.CullProperties;
import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.RetentionPolicy;
import cull.email.app.entity.Rule;
import cull.email.app.entity.RuleSet;
import cull.email.app.exception.RulePersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stores rules as TOML, one table per rule keyed by id:
 * <pre>
 * [rules.1]
 * id = 1
 * retention = "m:6"
 * generate_label = true
 * labels = ["newsletters"]
 * action = "trash"
 * </pre>
 */
@Slf4j
@Repository
public class TomlRuleRepository implements RuleRepository {
    private final TomlMapper mapper = new TomlMapper();
    private final Path path;
    private final String markerPrefix;

    @Autowired
    public TomlRuleRepository(CullProperties properties) {
        this(Paths.get(properties.getRulesFile()), properties.getMarkerPrefix());
    }

    public TomlRuleRepository(Path path, String markerPrefix) {
        this.path = path;
        this.markerPrefix = markerPrefix;
    }

    @Override
    public RuleSet load() {
        RuleSet ruleSet = new RuleSet(markerPrefix);
        if (!Files.exists(path)) {
            log.info("No rules file at {}, starting with an empty rule set", path);
            return ruleSet;
        }

        RuleDocument document;
        try {
            document = mapper.readValue(path.toFile(), RuleDocument.class);
        } catch (IOException e) {
            throw new RulePersistenceException("Could not read rules from " + path + ": " + e.getMessage(), e);
        }

        List<RuleDocument.Entry> entries = new ArrayList<>(document.getRules().values());
        // a label shared by two rules stays with the lower id
        entries.sort(Comparator.comparingLong(RuleDocument.Entry::getId));
        for (RuleDocument.Entry entry : entries) {
            List<String> labels = new ArrayList<>();
            for (String label : entry.getLabels()) {
                Rule owner = ruleSet.rulesByLabel().get(label);
                if (owner != null) {
                    log.warn("Label `{}` of rule #{} is already used by rule #{}, ignoring it", label,
                        entry.getId(), owner.getId());
                } else {
                    labels.add(label);
                }
            }
            try {
                ruleSet.putRule(new Rule(
                    entry.getId(),
                    RetentionPolicy.of(entry.getRetention(), entry.isGenerateLabel()),
                    labels,
                    entry.getAction() == null ? DisposalAction.TRASH : DisposalAction.parse(entry.getAction())));
            } catch (IllegalArgumentException e) {
                throw new RulePersistenceException("Invalid rule #" + entry.getId() + " in " + path + ": " + e.getMessage(), e);
            }
        }
        log.debug("Loaded {} rules from {}", ruleSet.size(), path);
        return ruleSet;
    }

    @Override
    public void save(RuleSet ruleSet) {
        RuleDocument document = new RuleDocument();
        for (Rule rule : ruleSet.rules()) {
            RuleDocument.Entry entry = new RuleDocument.Entry();
            entry.setId(rule.getId());
            entry.setRetention(rule.getRetention().getAge().toToken());
            entry.setGenerateLabel(rule.getRetention().isGenerateLabel());
            entry.setLabels(rule.getLabels());
            entry.setAction(rule.getAction().toString());
            document.getRules().put(String.valueOf(rule.getId()), entry);
        }

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), document);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved {} rules to {}", ruleSet.size(), path);
        } catch (IOException e) {
            throw new RulePersistenceException("Could not write rules to " + path + ": " + e.getMessage(), e);
        }
    }

    public Path getPath() {
        return path;
    }
}
