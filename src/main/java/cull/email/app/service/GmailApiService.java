package cull.email.app.service;

import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.DisposalResult;
import cull.email.app.entity.MailboxLabel;
import cull.email.app.entity.MessageSummary;
import cull.email.app.entity.SearchPage;

import java.io.IOException;
import java.util.List;

/**
 * Gmail operations the retention engine needs.
 */
public interface GmailApiService {
    /**
     * List every label in the mailbox.
     * @return labels with their ids
     * @throws cull.email.app.exception.NoLabelsFoundException if the mailbox has no labels
     * @throws IOException if the API call fails
     */
    List<MailboxLabel> listLabels() throws IOException;

    /**
     * Fetch one page of message ids matching a Gmail search query.
     * @param query Gmail search query
     * @param pageToken token from the previous page, or null for the first page
     * @param pageSize maximum ids on the page
     * @return page of ids and the token of the next page
     * @throws IOException if the API call fails
     */
    SearchPage searchMessages(String query, String pageToken, int pageSize) throws IOException;

    /**
     * Trash or delete a bounded batch of messages.
     * @param action what to do with the messages
     * @param messageIds ids, at most the provider batch limit
     * @return per-message result
     * @throws IOException if the whole batch failed
     */
    DisposalResult dispose(DisposalAction action, List<String> messageIds) throws IOException;

    /**
     * Get the id of a label, creating the label if it does not exist yet.
     * @param name label name
     * @return label id
     * @throws IOException if the API call fails
     */
    String ensureLabel(String name) throws IOException;

    /**
     * Add a label to a batch of messages.
     * @param labelId label id
     * @param messageIds ids, at most the provider batch limit
     * @throws IOException if the API call fails
     */
    void applyLabel(String labelId, List<String> messageIds) throws IOException;

    /**
     * Read the date and subject headers of a message.
     * @param messageId message id
     * @return summary; date and subject are null when the header is missing
     * @throws IOException if the API call fails
     */
    MessageSummary getMessageSummary(String messageId) throws IOException;
}
