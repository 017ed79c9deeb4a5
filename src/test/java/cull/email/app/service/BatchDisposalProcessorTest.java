package cull.email.app.service;

import cull.email.app.config.CullProperties;
import cull.email.app.entity.ChunkOutcome;
import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.DisposalResult;
import cull.email.app.entity.LabelOutcome;
import cull.email.app.entity.RetentionPolicy;
import cull.email.app.entity.Rule;
import cull.email.app.entity.RuleSet;
import cull.email.app.entity.RunMode;
import cull.email.app.entity.RunReport;
import cull.email.app.entity.SearchPage;
import cull.email.app.exception.RuleNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BatchDisposalProcessorTest {

    private static final String MARKER_1 = RuleSet.DEFAULT_MARKER_PREFIX + "rule-1";

    private CullProperties properties;
    private InMemoryGmailApiService gmail;
    private RuleSet ruleSet;

    @BeforeEach
    void setUp() {
        properties = new CullProperties();
        properties.setPageSize(500);
        properties.setBatchSize(1000);
        properties.setDisposalConcurrency(4);
        gmail = new InMemoryGmailApiService();
        ruleSet = new RuleSet();
    }

    private BatchDisposalProcessor processor(GmailApiService gmailApiService, Executor executor) {
        return processor(gmailApiService, executor, new QueryBuilder());
    }

    private BatchDisposalProcessor processor(GmailApiService gmailApiService, Executor executor,
                                             QueryBuilder queryBuilder) {
        return new BatchDisposalProcessor(gmailApiService, queryBuilder, new MessageEnumerator(gmailApiService),
            new MarkerLabelCache(gmailApiService), executor, properties);
    }

    private BatchDisposalProcessor processor() {
        return processor(gmail, Runnable::run);
    }

    private void rule(long id, String age, DisposalAction action, boolean generateLabel, String... labels) {
        ruleSet.putRule(new Rule(id, RetentionPolicy.of(age, generateLabel), List.of(labels), action));
    }

    @Test
    void run_ShouldProcessTrashRulesBeforeDeleteRules() {
        // Given
        gmail.withLabel("a").withLabel("b").withLabel("c")
            .withMessages("a", 2).withMessages("b", 2).withMessages("c", 2);
        rule(1, "d:30", DisposalAction.TRASH, false, "a");
        rule(2, "d:30", DisposalAction.DELETE, false, "b");
        rule(3, "d:30", DisposalAction.TRASH, false, "c");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.execute());

        // Then
        assertEquals(List.of(1L, 3L, 2L), report.ruleOrder());
        assertEquals(List.of(DisposalAction.TRASH, DisposalAction.TRASH, DisposalAction.DELETE), gmail.disposedActions);
        assertTrue(gmail.isTrashed("a-0"));
        assertFalse(gmail.exists("b-0"));
        assertFalse(report.isCancelled());
    }

    @Test
    void run_WithSkipTrash_ShouldOnlyRunDeleteRules() {
        // Given
        gmail.withLabel("a").withLabel("b").withLabel("c").withMessages("b", 1);
        rule(1, "d:30", DisposalAction.TRASH, false, "a");
        rule(2, "d:30", DisposalAction.DELETE, false, "b");
        rule(3, "d:30", DisposalAction.TRASH, false, "c");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.builder().mode(RunMode.EXECUTE).skipTrash(true).build());

        // Then
        assertEquals(List.of(2L), report.ruleOrder());
        assertEquals(List.of(DisposalAction.DELETE), gmail.disposedActions);
    }

    @Test
    void run_WithRuleIdFilter_ShouldOnlyRunThoseRules() {
        // Given
        gmail.withLabel("a").withLabel("b");
        rule(1, "d:30", DisposalAction.TRASH, false, "a");
        rule(2, "d:30", DisposalAction.TRASH, false, "b");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.builder().ruleId(2L).build());

        // Then
        assertEquals(List.of(2L), report.ruleOrder());
    }

    @Test
    void run_WithUnknownRuleId_ShouldThrowBeforeTouchingGmail() {
        // Given
        rule(1, "d:30", DisposalAction.TRASH, false, "a");

        // When & Then
        assertThrows(RuleNotFoundException.class,
            () -> processor().run(ruleSet, RunOptions.builder().ruleId(9L).build()));
        assertTrue(gmail.searchQueries.isEmpty());
    }

    @Test
    void run_WithFailingMiddleChunk_ShouldStillDisposeLaterChunks() {
        // Given
        gmail.withLabel("news").withMessages("news", 2500).failingDisposeCall(2);
        rule(1, "m:6", DisposalAction.TRASH, true, "news");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.execute());

        // Then
        LabelOutcome outcome = report.getOutcomes().get(0);
        assertEquals(LabelOutcome.Status.COMPLETED, outcome.getStatus());
        assertEquals(2500, outcome.getEnumerated());
        List<ChunkOutcome> chunks = outcome.getChunks();
        assertEquals(List.of(1000, 1000, 500),
            chunks.stream().map(chunk -> chunk.getAttempted().size()).collect(Collectors.toList()));

        assertEquals(1000, chunks.get(0).getSucceeded().size());
        assertTrue(chunks.get(1).getSucceeded().isEmpty());
        assertEquals(1000, chunks.get(1).getFailed().size());
        assertEquals("Backend Error", chunks.get(1).getFailed().get("news-1000"));
        assertEquals(500, chunks.get(2).getSucceeded().size());

        assertEquals(1500, outcome.succeededCount());
        assertEquals(1000, outcome.failedCount());
    }

    @Test
    void run_WithGenerateLabel_ShouldMarkOnlySucceededMessages() {
        // Given
        gmail.withLabel("news").withMessages("news", 2500).failingDisposeCall(2);
        rule(1, "m:6", DisposalAction.TRASH, true, "news");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.execute());

        // Then
        List<String> marked = gmail.appliedTo(MARKER_1);
        assertEquals(1500, marked.size());
        assertFalse(marked.contains("news-1000"));
        assertTrue(marked.contains("news-0"));
        assertTrue(marked.contains("news-2499"));
        List<ChunkOutcome> chunks = report.chunkOutcomes();
        assertTrue(chunks.get(0).isMarkerApplied());
        assertFalse(chunks.get(1).isMarkerApplied());
        assertTrue(chunks.get(2).isMarkerApplied());
    }

    @Test
    void run_Twice_ShouldExcludeAlreadyMarkedMessages() {
        // Given
        gmail.withLabel("news").withMessages("news", 3);
        rule(1, "m:6", DisposalAction.TRASH, true, "news");

        // When
        RunReport first = processor().run(ruleSet, RunOptions.execute());
        RunReport second = processor().run(ruleSet, RunOptions.execute());

        // Then
        assertEquals("label:news older_than:180d", first.getOutcomes().get(0).getQuery());
        assertEquals(3, first.getOutcomes().get(0).getEnumerated());
        assertEquals("label:news older_than:180d -label:" + MARKER_1, second.getOutcomes().get(0).getQuery());
        assertEquals(0, second.getOutcomes().get(0).getEnumerated());
        assertEquals(1, gmail.disposedChunks.size());
    }

    @Test
    void run_WithoutGenerateLabel_ShouldNotCreateMarker() {
        // Given
        gmail.withLabel("news").withMessages("news", 3);
        rule(1, "m:6", DisposalAction.TRASH, false, "news");

        // When
        processor().run(ruleSet, RunOptions.execute());

        // Then
        assertTrue(gmail.appliedLabels.isEmpty());
        assertTrue(gmail.listLabels().stream().noneMatch(label -> label.getName().equals(MARKER_1)));
    }

    @Test
    void run_InDryRun_ShouldNeverModifyMailbox() {
        // Given
        gmail.withLabel("news").withMessages("news", 1200);
        rule(1, "m:6", DisposalAction.DELETE, true, "news");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.dryRun());

        // Then
        assertEquals(RunMode.DRY_RUN, report.getMode());
        assertTrue(gmail.disposedChunks.isEmpty());
        assertTrue(gmail.appliedLabels.isEmpty());
        assertTrue(gmail.exists("news-0"));
        LabelOutcome outcome = report.getOutcomes().get(0);
        List<String> attempted = new ArrayList<>();
        outcome.getChunks().forEach(chunk -> {
            assertTrue(chunk.isDryRun());
            assertTrue(chunk.getSucceeded().isEmpty());
            attempted.addAll(chunk.getAttempted());
        });
        assertEquals(outcome.getEnumerated(), attempted.size());
        assertEquals(2, outcome.getChunks().size());
    }

    @Test
    void run_WithLabelMissingFromMailbox_ShouldContinueWithNextLabel() {
        // Given
        gmail.withLabel("present").withMessages("present", 2);
        rule(1, "d:10", DisposalAction.TRASH, false, "gone", "present");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.execute());

        // Then
        assertEquals(2, report.getOutcomes().size());
        LabelOutcome missing = report.getOutcomes().get(0);
        assertEquals(LabelOutcome.Status.FAILED, missing.getStatus());
        assertEquals("LabelNotFoundInMailboxException", missing.getErrorType());
        assertEquals(LabelOutcome.Status.COMPLETED, report.getOutcomes().get(1).getStatus());
        assertEquals(2, report.getOutcomes().get(1).succeededCount());
    }

    @Test
    void run_WithEmptyMailboxLabels_ShouldFailEveryLabel() {
        // Given
        rule(1, "d:10", DisposalAction.TRASH, false, "a");
        rule(2, "d:10", DisposalAction.DELETE, false, "b");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.execute());

        // Then
        assertEquals(2, report.getOutcomes().size());
        report.getOutcomes().forEach(outcome -> {
            assertEquals(LabelOutcome.Status.FAILED, outcome.getStatus());
            assertEquals("NoLabelsFoundException", outcome.getErrorType());
        });
        assertTrue(gmail.searchQueries.isEmpty());
    }

    @Test
    void run_WithRuleWithoutLabels_ShouldSkipIt() {
        // Given
        gmail.withLabel("a");
        rule(1, "d:10", DisposalAction.TRASH, false);

        // When
        RunReport report = processor().run(ruleSet, RunOptions.execute());

        // Then
        assertEquals(LabelOutcome.Status.SKIPPED, report.getOutcomes().get(0).getStatus());
        assertTrue(gmail.searchQueries.isEmpty());
    }

    @Test
    void run_WhenSearchFails_ShouldReportLabelAsFailed() {
        // Given
        InMemoryGmailApiService failingSearch = new InMemoryGmailApiService() {
            @Override
            public synchronized SearchPage searchMessages(String query, String pageToken, int pageSize) {
                throw new IllegalStateException("rate limited");
            }
        };
        failingSearch.withLabel("a").withMessages("a", 1);
        rule(1, "d:10", DisposalAction.TRASH, false, "a");

        // When
        RunReport report = processor(failingSearch, Runnable::run).run(ruleSet, RunOptions.execute());

        // Then
        LabelOutcome outcome = report.getOutcomes().get(0);
        assertEquals(LabelOutcome.Status.FAILED, outcome.getStatus());
        assertEquals("EnumerationException", outcome.getErrorType());
        assertTrue(outcome.getChunks().isEmpty());
    }

    @Test
    void run_WhenCancelledMidLabel_ShouldStopAfterCurrentChunk() {
        // Given
        RunCancellation cancellation = new RunCancellation();
        InMemoryGmailApiService cancelling = new InMemoryGmailApiService() {
            @Override
            public synchronized DisposalResult dispose(DisposalAction action, List<String> messageIds)
                    throws IOException {
                cancellation.cancel();
                return super.dispose(action, messageIds);
            }
        };
        cancelling.withLabel("a").withLabel("b").withMessages("a", 2500).withMessages("b", 5);
        rule(1, "d:10", DisposalAction.TRASH, false, "a");
        rule(2, "d:10", DisposalAction.TRASH, false, "b");

        // When
        RunReport report = processor(cancelling, Runnable::run).run(ruleSet,
            RunOptions.builder().mode(RunMode.EXECUTE).cancellation(cancellation).build());

        // Then
        assertTrue(report.isCancelled());
        assertEquals(1, report.getOutcomes().size());
        LabelOutcome outcome = report.getOutcomes().get(0);
        assertEquals(LabelOutcome.Status.CANCELLED, outcome.getStatus());
        assertEquals(1, outcome.getChunks().size());
        assertEquals(1, cancelling.disposedChunks.size());
    }

    @Test
    void run_WhenAlreadyCancelled_ShouldDoNothing() {
        // Given
        gmail.withLabel("a").withMessages("a", 1);
        rule(1, "d:10", DisposalAction.TRASH, false, "a");
        RunCancellation cancellation = new RunCancellation();
        cancellation.cancel();

        // When
        RunReport report = processor().run(ruleSet, RunOptions.builder().cancellation(cancellation).build());

        // Then
        assertTrue(report.isCancelled());
        assertTrue(report.getOutcomes().isEmpty());
    }

    @Test
    void run_OnThreadPool_ShouldKeepChunkOrderInReport() {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(4);
        gmail.withLabel("news").withMessages("news", 4500);
        rule(1, "d:10", DisposalAction.TRASH, true, "news");

        try {
            // When
            RunReport report = processor(gmail, pool).run(ruleSet, RunOptions.execute());

            // Then
            List<ChunkOutcome> chunks = report.chunkOutcomes();
            assertEquals(5, chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                assertEquals(i, chunks.get(i).getChunkIndex());
                assertEquals("news-" + (i * 1000), chunks.get(i).getAttempted().get(0));
            }
            assertEquals(4500, report.getOutcomes().get(0).succeededCount());
            assertEquals(4500, gmail.appliedTo(RuleSet.DEFAULT_MARKER_PREFIX + "rule-1").size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void partition_ShouldSplitIntoFixedSizeChunks() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            ids.add("m" + i);
        }

        List<List<String>> chunks = BatchDisposalProcessor.partition(ids, 3);

        assertEquals(List.of(List.of("m0", "m1", "m2"), List.of("m3", "m4", "m5"), List.of("m6")), chunks);
        assertTrue(BatchDisposalProcessor.partition(List.of(), 3).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> BatchDisposalProcessor.partition(ids, 0));
    }

    @Test
    void run_WhenQueryCannotBeBuilt_ShouldFailOnlyThatLabel() {
        // Given
        gmail.withLabel("a").withLabel("b").withMessages("a", 1).withMessages("b", 2);
        rule(1, "y:1", DisposalAction.TRASH, false, "a");
        rule(2, "d:1", DisposalAction.TRASH, false, "b");
        QueryBuilder overflowing = new QueryBuilder() {
            @Override
            public String build(String label, RetentionPolicy policy, String exclusionLabel) {
                if (label.equals("a")) {
                    throw new ArithmeticException("long overflow");
                }
                return super.build(label, policy, exclusionLabel);
            }
        };

        // When
        RunReport report = processor(gmail, Runnable::run, overflowing).run(ruleSet, RunOptions.dryRun());

        // Then
        assertEquals(2, report.getOutcomes().size());
        LabelOutcome broken = report.getOutcomes().get(0);
        assertEquals(LabelOutcome.Status.FAILED, broken.getStatus());
        assertTrue(broken.getError().contains("long overflow"));
        LabelOutcome fine = report.getOutcomes().get(1);
        assertEquals(LabelOutcome.Status.COMPLETED, fine.getStatus());
        assertEquals(2, fine.getEnumerated());
    }

    @Test
    void run_WhenExecutorRejectsChunk_ShouldKeepConcurrencyLimit() throws Exception {
        // Given
        properties.setDisposalConcurrency(1);
        properties.setBatchSize(10);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        InMemoryGmailApiService slow = new InMemoryGmailApiService() {
            @Override
            public DisposalResult dispose(DisposalAction action, List<String> messageIds) throws IOException {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                inFlight.decrementAndGet();
                return super.dispose(action, messageIds);
            }
        };
        slow.withLabel("news").withMessages("news", 40);
        rule(1, "d:10", DisposalAction.TRASH, false, "news");

        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean rejectedOnce = new AtomicBoolean();
        Executor rejectingFirst = task -> {
            if (rejectedOnce.compareAndSet(false, true)) {
                throw new RejectedExecutionException("queue full");
            }
            pool.execute(task);
        };

        try {
            // When
            RunReport report = processor(slow, rejectingFirst).run(ruleSet, RunOptions.execute());

            // Then
            List<ChunkOutcome> chunks = report.chunkOutcomes();
            assertEquals(4, chunks.size());
            assertEquals("queue full", chunks.get(0).getFailed().get("news-0"));
            assertEquals(30, report.getOutcomes().get(0).succeededCount());
            assertEquals(1, maxInFlight.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void run_DeleteRuleWithGenerateLabel_ShouldNotApplyMarker() {
        // Given
        gmail.withLabel("old").withMessages("old", 3);
        rule(1, "d:10", DisposalAction.DELETE, true, "old");

        // When
        RunReport report = processor().run(ruleSet, RunOptions.execute());

        // Then
        ChunkOutcome chunk = report.chunkOutcomes().get(0);
        assertEquals(3, chunk.getSucceeded().size());
        assertFalse(chunk.isMarkerApplied());
        assertNull(chunk.getMarkerError());
        assertTrue(gmail.appliedLabels.isEmpty());
        assertTrue(gmail.listLabels().stream().noneMatch(label -> label.getName().equals(MARKER_1)));
        assertEquals("label:old older_than:10d", report.getOutcomes().get(0).getQuery());
    }
}
