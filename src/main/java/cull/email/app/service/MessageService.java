package cull.email.app.service;

import cull.email.app.config.CullProperties;
import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.DisposalResult;
import cull.email.app.entity.MailboxLabel;
import cull.email.app.entity.MessageDisposalReport;
import cull.email.app.entity.MessageSummary;
import cull.email.app.entity.RunMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Mailbox operations outside of rules: list labels, and list, trash or delete
 * the messages matching labels and a free-form query.
 */
@Slf4j
@Service
public class MessageService {
    private final GmailApiService gmailApiService;
    private final QueryBuilder queryBuilder;
    private final MessageEnumerator messageEnumerator;
    private final CullProperties properties;

    public MessageService(
            GmailApiService gmailApiService,
            QueryBuilder queryBuilder,
            MessageEnumerator messageEnumerator,
            CullProperties properties) {
        this.gmailApiService = gmailApiService;
        this.queryBuilder = queryBuilder;
        this.messageEnumerator = messageEnumerator;
        this.properties = properties;
    }

    public List<MailboxLabel> listLabels() throws IOException {
        List<MailboxLabel> labels = gmailApiService.listLabels();
        log.info("Mailbox has {} labels", labels.size());
        return labels;
    }

    public List<String> findMessages(MessageQuery messageQuery) {
        String search = queryBuilder.search(messageQuery.getLabels(), messageQuery.getQuery());
        log.debug("Searching messages with `{}`", search);
        return messageEnumerator.enumerate(search, messageQuery.getMaxResults(), messageQuery.getMaxPages());
    }

    /**
     * Matching messages with their date and subject, each also logged at INFO.
     */
    public List<MessageSummary> listMessages(MessageQuery messageQuery) throws IOException {
        List<MessageSummary> summaries = new ArrayList<>();
        for (String id : findMessages(messageQuery)) {
            MessageSummary summary = gmailApiService.getMessageSummary(id);
            log.info("{}", summary.describe());
            summaries.add(summary);
        }
        return summaries;
    }

    /**
     * Trash or delete every message matching the query, in batches of
     * {@code cull.batch-size}. A failed batch is recorded and the next one
     * still runs. In dry-run mode nothing is modified.
     * @throws IllegalArgumentException if neither labels nor a query are given
     */
    public MessageDisposalReport dispose(MessageQuery messageQuery, DisposalAction action, RunMode mode) {
        String search = queryBuilder.search(messageQuery.getLabels(), messageQuery.getQuery());
        if (search.isEmpty()) {
            throw new IllegalArgumentException("A query or at least one label is required to " + action
                + " messages");
        }

        List<String> ids = messageEnumerator.enumerate(search, messageQuery.getMaxResults(),
            messageQuery.getMaxPages());
        MessageDisposalReport.MessageDisposalReportBuilder report = MessageDisposalReport.builder()
            .query(search)
            .action(action)
            .mode(mode)
            .enumerated(ids.size())
            .attempted(ids);
        log.info("{} message(s) match `{}`", ids.size(), search);

        if (mode == RunMode.DRY_RUN) {
            log.info("Dry run: would {} {} message(s)", action, ids.size());
            return report.build();
        }

        for (List<String> chunk : BatchDisposalProcessor.partition(ids, properties.getBatchSize())) {
            logSubjects(chunk, action);
            try {
                DisposalResult result = gmailApiService.dispose(action, chunk);
                report.succeeded(result.getSucceeded()).failed(result.getFailed());
            } catch (Exception e) {
                log.error("Failed to {} {} message(s): {}", action, chunk.size(), e.getMessage(), e);
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                report.failed(DisposalResult.allFailed(chunk, reason).getFailed());
            }
        }
        return report.build();
    }

    private void logSubjects(List<String> ids, DisposalAction action) {
        if (!log.isDebugEnabled()) {
            return;
        }
        for (String id : ids) {
            try {
                log.debug("About to {}: {}", action, gmailApiService.getMessageSummary(id).describe());
            } catch (IOException e) {
                log.debug("No summary for message {}: {}", id, e.getMessage());
            }
        }
    }
}
