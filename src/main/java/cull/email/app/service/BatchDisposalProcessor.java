package cull.email.app.service;

import cull.email.app.config.CullProperties;
import cull.email.app.entity.ChunkOutcome;
import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.DisposalResult;
import cull.email.app.entity.LabelOutcome;
import cull.email.app.entity.MailboxLabel;
import cull.email.app.entity.Rule;
import cull.email.app.entity.RuleSet;
import cull.email.app.entity.RunMode;
import cull.email.app.entity.RunReport;
import cull.email.app.exception.DisposalException;
import cull.email.app.exception.EnumerationException;
import cull.email.app.exception.LabelNotFoundInMailboxException;
import cull.email.app.exception.NoLabelsFoundException;
import cull.email.app.exception.RetentionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Runs retention rules against the mailbox.
 * <p>
 * All selected trash rules run before any delete rule, each group by ascending
 * rule id. For every label of a rule the matching messages are enumerated,
 * split into batches of {@code cull.batch-size} and each batch is trashed or
 * deleted on its own, so one failed batch does not stop the next. Batches of
 * one label may run in parallel on the disposal executor; the label is only
 * reported once all of its batches have finished.
 * <p>
 * In dry-run mode nothing is sent to Gmail except searches.
 */
@Slf4j
@Service
public class BatchDisposalProcessor {
    private final GmailApiService gmailApiService;
    private final QueryBuilder queryBuilder;
    private final MessageEnumerator messageEnumerator;
    private final MarkerLabelCache markerLabelCache;
    private final Executor disposalExecutor;
    private final CullProperties properties;

    public BatchDisposalProcessor(
            GmailApiService gmailApiService,
            QueryBuilder queryBuilder,
            MessageEnumerator messageEnumerator,
            MarkerLabelCache markerLabelCache,
            @Qualifier("disposalExecutor") Executor disposalExecutor,
            CullProperties properties) {
        this.gmailApiService = gmailApiService;
        this.queryBuilder = queryBuilder;
        this.messageEnumerator = messageEnumerator;
        this.markerLabelCache = markerLabelCache;
        this.disposalExecutor = disposalExecutor;
        this.properties = properties;
    }

    /**
     * Run the selected rules of a rule set.
     * @throws cull.email.app.exception.RuleNotFoundException if {@code options} names a rule id
     *         that is not in the rule set; raised before any Gmail call
     */
    public RunReport run(RuleSet ruleSet, RunOptions options) {
        List<Rule> selected = selectRules(ruleSet, options);
        RunMode mode = options.getMode();
        RunCancellation cancellation = options.getCancellation();
        log.info("Running {} rule(s) in {} mode", selected.size(), mode);

        Map<String, String> mailboxLabels = new HashMap<>();
        RetentionException labelError = null;
        try {
            List<MailboxLabel> labels = gmailApiService.listLabels();
            if (labels.isEmpty()) {
                throw new NoLabelsFoundException();
            }
            for (MailboxLabel label : labels) {
                mailboxLabels.put(label.getName(), label.getId());
            }
            markerLabelCache.clear();
            markerLabelCache.seed(labels, ruleSet.getMarkerPrefix());
        } catch (RetentionException e) {
            log.warn("Cannot resolve labels: {}", e.getMessage());
            labelError = e;
        } catch (Exception e) {
            log.error("Failed to list labels: {}", e.getMessage(), e);
            labelError = new RetentionException("Failed to list labels: " + e.getMessage(), e);
        }

        List<LabelOutcome> outcomes = new ArrayList<>();
        boolean cancelled = false;

        for (Rule rule : selected) {
            if (cancelled || cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            if (!rule.hasLabels()) {
                log.info("Rule #{} has no labels, skipping", rule.getId());
                outcomes.add(LabelOutcome.builder()
                    .ruleId(rule.getId())
                    .action(rule.getAction())
                    .status(LabelOutcome.Status.SKIPPED)
                    .build());
                continue;
            }

            for (String label : rule.getLabels()) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    break;
                }
                log.info("Executing rule #{} for label `{}`: {}", rule.getId(), label, rule.describe());
                LabelOutcome outcome = processLabel(rule, label, ruleSet.getMarkerPrefix(),
                    mailboxLabels, labelError, mode, cancellation);
                outcomes.add(outcome);
                if (outcome.getStatus() == LabelOutcome.Status.CANCELLED) {
                    cancelled = true;
                    break;
                }
            }
        }

        if (cancelled) {
            log.warn("Run cancelled after {} label(s)", outcomes.size());
        }
        log.info("Run finished: {} label outcome(s), {} chunk(s)", outcomes.size(),
            outcomes.stream().mapToInt(outcome -> outcome.getChunks().size()).sum());
        return new RunReport(mode, outcomes, cancelled);
    }

    /**
     * Rules to run, in execution order: trash rules by ascending id, then
     * delete rules by ascending id, minus skipped actions.
     */
    public List<Rule> selectRules(RuleSet ruleSet, RunOptions options) {
        for (Long id : options.getRuleIds()) {
            ruleSet.requireRule(id);
        }

        List<Rule> selected = new ArrayList<>();
        for (DisposalAction action : new DisposalAction[] {DisposalAction.TRASH, DisposalAction.DELETE}) {
            if (options.isSkipped(action)) {
                log.info("Skipping {} rules", action);
                continue;
            }
            for (Rule rule : ruleSet.rules()) {
                if (rule.getAction() != action) {
                    continue;
                }
                if (!options.getRuleIds().isEmpty() && !options.getRuleIds().contains(rule.getId())) {
                    continue;
                }
                selected.add(rule);
            }
        }
        return selected;
    }

    private LabelOutcome processLabel(Rule rule, String label, String markerPrefix,
                                      Map<String, String> mailboxLabels, RetentionException labelError,
                                      RunMode mode, RunCancellation cancellation) {
        LabelOutcome.LabelOutcomeBuilder outcome = LabelOutcome.builder()
            .ruleId(rule.getId())
            .label(label)
            .action(rule.getAction());

        if (labelError != null) {
            return failed(outcome, labelError);
        }
        if (!mailboxLabels.containsKey(label)) {
            LabelNotFoundInMailboxException e = new LabelNotFoundInMailboxException(label);
            log.warn("Nothing to process for rule #{}: {}", rule.getId(), e.getMessage());
            return failed(outcome, e);
        }

        // deleted messages cannot carry a label
        boolean generateLabel = rule.getRetention().isGenerateLabel() && rule.getAction() != DisposalAction.DELETE;
        String marker = generateLabel ? rule.markerLabel(markerPrefix) : null;
        String exclusion = marker != null && markerLabelCache.find(marker).isPresent() ? marker : null;
        String query;
        try {
            query = queryBuilder.build(label, rule.getRetention(), exclusion);
        } catch (RuntimeException e) {
            log.error("Cannot build query for rule #{} label `{}`: {}", rule.getId(), label, e.getMessage());
            return failed(outcome, new RetentionException("Cannot build query for rule #" + rule.getId()
                + " label `" + label + "`: " + e.getMessage(), e));
        }
        outcome.query(query);
        log.debug("Query for rule #{} label `{}`: {}", rule.getId(), label, query);

        List<String> ids;
        try {
            ids = messageEnumerator.enumerate(query, properties.getPageSize(), properties.getMaxPages());
        } catch (EnumerationException e) {
            log.error("Rule #{} label `{}`: {}", rule.getId(), label, e.getMessage());
            return failed(outcome.enumerated(e.getPartialIds().size()), e);
        }
        outcome.enumerated(ids.size());
        log.info("Rule #{} label `{}`: {} message(s) match", rule.getId(), label, ids.size());

        List<List<String>> chunks = partition(ids, properties.getBatchSize());
        List<CompletableFuture<ChunkOutcome>> futures = new ArrayList<>();
        Semaphore inFlight = new Semaphore(Math.max(1, properties.getDisposalConcurrency()));
        boolean stopped = false;

        for (int i = 0; i < chunks.size(); i++) {
            try {
                inFlight.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Disposal interrupted for rule #{} label `{}`", rule.getId(), label);
                stopped = true;
                break;
            }
            if (cancellation.isCancelled()) {
                inFlight.release();
                stopped = true;
                break;
            }

            int chunkIndex = i;
            List<String> chunk = chunks.get(i);
            CompletableFuture<ChunkOutcome> future;
            try {
                future = CompletableFuture.supplyAsync(
                    () -> disposeChunk(rule, label, chunkIndex, chunk, mode, marker), disposalExecutor);
            } catch (RuntimeException e) {
                // executor rejected the task; the permit is released by whenComplete below
                future = CompletableFuture.completedFuture(failedChunk(rule, label, chunkIndex, chunk, mode, e));
            }
            futures.add(future.whenComplete((result, ex) -> inFlight.release()));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .exceptionally(ex -> {
                log.error("Error in disposal for rule #{} label `{}`: {}", rule.getId(), label, ex.getMessage(), ex);
                return null;
            })
            .join();

        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<ChunkOutcome> future = futures.get(i);
            ChunkOutcome chunkOutcome;
            if (future.isCompletedExceptionally()) {
                chunkOutcome = failedChunk(rule, label, i, chunks.get(i), mode, unwrap(future));
            } else {
                chunkOutcome = future.join();
            }
            outcome.chunk(chunkOutcome);
        }

        if (stopped) {
            log.warn("Rule #{} label `{}` cancelled after {} of {} chunk(s)", rule.getId(), label,
                futures.size(), chunks.size());
            return outcome.status(LabelOutcome.Status.CANCELLED).build();
        }
        return outcome.status(LabelOutcome.Status.COMPLETED).build();
    }

    ChunkOutcome disposeChunk(Rule rule, String label, int chunkIndex, List<String> ids, RunMode mode, String marker) {
        ChunkOutcome.ChunkOutcomeBuilder outcome = ChunkOutcome.builder()
            .ruleId(rule.getId())
            .label(label)
            .action(rule.getAction())
            .chunkIndex(chunkIndex)
            .attempted(ids);

        if (mode == RunMode.DRY_RUN) {
            log.info("Dry run: rule #{} label `{}` chunk {} would {} {} message(s)",
                rule.getId(), label, chunkIndex, rule.getAction(), ids.size());
            return outcome.dryRun(true).build();
        }

        DisposalResult result;
        try {
            result = gmailApiService.dispose(rule.getAction(), ids);
        } catch (Exception e) {
            DisposalException failure = new DisposalException(rule.getId(), label, chunkIndex, ids.size(), e);
            log.error(failure.getMessage(), e);
            result = DisposalResult.allFailed(ids, reason(e));
        }
        outcome.succeeded(result.getSucceeded()).failed(result.getFailed());
        log.info("Rule #{} label `{}` chunk {}: {} {}, {} failed", rule.getId(), label, chunkIndex,
            result.getSucceeded().size(), rule.getAction() == DisposalAction.TRASH ? "trashed" : "deleted",
            result.getFailed().size());

        if (marker != null && !result.getSucceeded().isEmpty()) {
            try {
                String markerId = markerLabelCache.resolve(marker);
                gmailApiService.applyLabel(markerId, result.getSucceeded());
                outcome.markerApplied(true);
            } catch (Exception e) {
                log.warn("Could not apply marker label `{}` to chunk {} of rule #{} label `{}`: {}",
                    marker, chunkIndex, rule.getId(), label, e.getMessage());
                outcome.markerError(reason(e));
            }
        }
        return outcome.build();
    }

    static List<List<String>> partition(List<String> ids, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("batch size must be > 0");
        }
        List<List<String>> chunks = new ArrayList<>();
        for (int i = 0; i < ids.size(); i += size) {
            chunks.add(List.copyOf(ids.subList(i, Math.min(i + size, ids.size()))));
        }
        return chunks;
    }

    private ChunkOutcome failedChunk(Rule rule, String label, int chunkIndex, List<String> ids, RunMode mode,
                                     Throwable error) {
        log.error("Chunk {} of rule #{} label `{}` did not run: {}", chunkIndex, rule.getId(), label,
            error.getMessage());
        ChunkOutcome.ChunkOutcomeBuilder outcome = ChunkOutcome.builder()
            .ruleId(rule.getId())
            .label(label)
            .action(rule.getAction())
            .chunkIndex(chunkIndex)
            .dryRun(mode == RunMode.DRY_RUN)
            .attempted(ids);
        if (mode == RunMode.EXECUTE) {
            outcome.failed(DisposalResult.allFailed(ids, reason(error)).getFailed());
        }
        return outcome.build();
    }

    private static LabelOutcome failed(LabelOutcome.LabelOutcomeBuilder outcome, RetentionException error) {
        return outcome.status(LabelOutcome.Status.FAILED)
            .error(error.getMessage())
            .errorType(error.getClass().getSimpleName())
            .build();
    }

    private static Throwable unwrap(CompletableFuture<ChunkOutcome> future) {
        try {
            future.join();
            return new IllegalStateException("chunk completed normally");
        } catch (RuntimeException e) {
            return e.getCause() != null ? e.getCause() : e;
        }
    }

    private static String reason(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
