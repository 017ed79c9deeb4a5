package cull.email.app.repository;

import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.RetentionPolicy;
import cull.email.app.entity.Rule;
import cull.email.app.entity.RuleSet;
import cull.email.app.exception.InvalidMessageAgeException;
import cull.email.app.exception.RulePersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TomlRuleRepositoryTest {

    @TempDir
    Path tempDir;

    private Path rulesFile;
    private TomlRuleRepository repository;

    @BeforeEach
    void setUp() {
        rulesFile = tempDir.resolve("config").resolve("rules.toml");
        repository = new TomlRuleRepository(rulesFile, RuleSet.DEFAULT_MARKER_PREFIX);
    }

    @Test
    void load_WithMissingFile_ShouldReturnEmptyRuleSet() {
        RuleSet ruleSet = repository.load();

        assertTrue(ruleSet.isEmpty());
        assertEquals(RuleSet.DEFAULT_MARKER_PREFIX, ruleSet.getMarkerPrefix());
    }

    @Test
    void save_ThenLoad_ShouldRestoreRules() {
        // Given
        RuleSet ruleSet = new RuleSet();
        ruleSet.addRule(RetentionPolicy.of("m:6", true), List.of("newsletters", "Old Receipts"), DisposalAction.TRASH);
        ruleSet.addRule(RetentionPolicy.of("y:2", false), List.of("alerts"), DisposalAction.DELETE);
        ruleSet.addRule(RetentionPolicy.of("d:30", false), List.of(), DisposalAction.TRASH);

        // When
        repository.save(ruleSet);
        RuleSet loaded = repository.load();

        // Then
        assertTrue(Files.exists(rulesFile));
        assertEquals(descriptions(ruleSet), descriptions(loaded));
        Rule first = loaded.requireRule(1);
        assertEquals(List.of("newsletters", "Old Receipts"), first.getLabels());
        assertTrue(first.getRetention().isGenerateLabel());
        assertEquals(DisposalAction.DELETE, loaded.requireRule(2).getAction());
        assertFalse(loaded.requireRule(3).hasLabels());
    }

    @Test
    void save_ShouldOverwritePreviousContent() {
        // Given
        RuleSet ruleSet = new RuleSet();
        ruleSet.addRule(RetentionPolicy.of("m:6", true), List.of("a"), DisposalAction.TRASH);
        repository.save(ruleSet);

        // When
        ruleSet.removeRule(1);
        repository.save(ruleSet);

        // Then
        assertTrue(repository.load().isEmpty());
    }

    @Test
    void load_WithHandWrittenFile_ShouldParseTables() throws IOException {
        // Given
        Files.createDirectories(rulesFile.getParent());
        Files.writeString(rulesFile, String.join("\n",
            "[rules.\"4\"]",
            "id = 4",
            "retention = \"y:1\"",
            "generate_label = true",
            "labels = [\"archive\"]",
            "action = \"delete\"",
            "",
            "[rules.\"2\"]",
            "id = 2",
            "retention = \"d:45\"",
            "generate_label = false",
            "labels = [\"promotions\", \"social\"]",
            ""));

        // When
        RuleSet ruleSet = repository.load();

        // Then
        assertEquals(2, ruleSet.size());
        assertEquals(2, ruleSet.rules().get(0).getId());
        assertEquals(DisposalAction.TRASH, ruleSet.requireRule(2).getAction());
        assertEquals(List.of("promotions", "social"), ruleSet.requireRule(2).getLabels());
        assertEquals("y:1", ruleSet.requireRule(4).getRetention().getAge().toToken());
        assertEquals(DisposalAction.DELETE, ruleSet.requireRule(4).getAction());
    }

    @Test
    void load_WithInvalidRetention_ShouldThrowInvalidMessageAge() throws IOException {
        // Given
        Files.createDirectories(rulesFile.getParent());
        Files.writeString(rulesFile, "[rules.\"1\"]\nid = 1\nretention = \"w:2\"\nlabels = [\"a\"]\n");

        // When & Then
        InvalidMessageAgeException exception = assertThrows(InvalidMessageAgeException.class, () -> repository.load());
        assertEquals(InvalidMessageAgeException.Reason.UNKNOWN_UNIT, exception.getReason());
    }

    @Test
    void load_WithUnknownAction_ShouldThrowPersistenceError() throws IOException {
        // Given
        Files.createDirectories(rulesFile.getParent());
        Files.writeString(rulesFile, "[rules.\"1\"]\nid = 1\nretention = \"d:2\"\naction = \"archive\"\n");

        // When & Then
        assertThrows(RulePersistenceException.class, () -> repository.load());
    }

    @Test
    void load_WithLabelInTwoRules_ShouldKeepLabelOnLowerIdOnly() throws IOException {
        // Given
        Files.createDirectories(rulesFile.getParent());
        Files.writeString(rulesFile, String.join("\n",
            "[rules.\"1\"]", "id = 1", "retention = \"d:2\"", "labels = [\"a\"]", "",
            "[rules.\"2\"]", "id = 2", "retention = \"d:3\"", "labels = [\"a\", \"b\"]", ""));

        // When
        RuleSet ruleSet = repository.load();

        // Then
        assertEquals(2, ruleSet.size());
        assertEquals(List.of("a"), ruleSet.requireRule(1).getLabels());
        assertEquals(List.of("b"), ruleSet.requireRule(2).getLabels());
    }

    @Test
    void load_WithBrokenToml_ShouldThrowPersistenceError() throws IOException {
        // Given
        Files.createDirectories(rulesFile.getParent());
        Files.writeString(rulesFile, "[rules\nid = = 1\n");

        // When & Then
        assertThrows(RulePersistenceException.class, () -> repository.load());
    }

    private static List<String> descriptions(RuleSet ruleSet) {
        return ruleSet.rules().stream()
            .map(rule -> rule.describe() + " generate=" + rule.getRetention().isGenerateLabel())
            .collect(Collectors.toList());
    }
}
