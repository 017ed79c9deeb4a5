package cull.email.app.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.BatchDeleteMessagesRequest;
import com.google.api.services.gmail.model.BatchModifyMessagesRequest;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePartHeader;
import cull.email.app.config.CullProperties;
import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.DisposalResult;
import cull.email.app.entity.MailboxLabel;
import cull.email.app.entity.MessageSummary;
import cull.email.app.entity.SearchPage;
import cull.email.app.exception.NoLabelsFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
public class GmailService implements GmailApiService {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String TRASH_LABEL = "TRASH";

    private final NetHttpTransport httpTransport;
    private final TokenRefreshService tokenRefreshService;
    private final String userId;
    private final String applicationName;

    public GmailService(TokenRefreshService tokenRefreshService, CullProperties properties) throws Exception {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        this.tokenRefreshService = tokenRefreshService;
        this.userId = properties.getGmail().getUserId();
        this.applicationName = properties.getGmail().getApplicationName();
    }

    public Gmail getGmailService(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(accessToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
            .setApplicationName(applicationName)
            .build();
    }

    @Override
    public List<MailboxLabel> listLabels() throws IOException {
        ListLabelsResponse response = execute(service -> service.users().labels().list(userId).execute());
        if (response.getLabels() == null || response.getLabels().isEmpty()) {
            throw new NoLabelsFoundException();
        }

        List<MailboxLabel> labels = new ArrayList<>();
        for (Label label : response.getLabels()) {
            if (label.getId() != null && label.getName() != null) {
                labels.add(new MailboxLabel(label.getName(), label.getId()));
            }
        }
        log.debug("Mailbox {} has {} labels", userId, labels.size());
        return labels;
    }

    @Override
    public SearchPage searchMessages(String query, String pageToken, int pageSize) throws IOException {
        ListMessagesResponse response = execute(service -> {
            Gmail.Users.Messages.List request = service.users().messages().list(userId)
                .setQ(query)
                .setMaxResults((long) pageSize);
            if (pageToken != null) {
                request.setPageToken(pageToken);
            }
            return request.execute();
        });

        List<String> ids = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message messageRef : response.getMessages()) {
                if (messageRef.getId() != null) {
                    ids.add(messageRef.getId());
                }
            }
        }
        return new SearchPage(ids, response.getNextPageToken());
    }

    /**
     * Gmail batch endpoints either apply to every id or fail as a whole, so a
     * call that returns reports all ids as succeeded.
     */
    @Override
    public DisposalResult dispose(DisposalAction action, List<String> messageIds) throws IOException {
        if (messageIds.isEmpty()) {
            return DisposalResult.allSucceeded(messageIds);
        }

        switch (action) {
            case TRASH:
                BatchModifyMessagesRequest trash = new BatchModifyMessagesRequest()
                    .setIds(messageIds)
                    .setAddLabelIds(Collections.singletonList(TRASH_LABEL));
                execute(service -> service.users().messages().batchModify(userId, trash).execute());
                break;
            case DELETE:
                BatchDeleteMessagesRequest delete = new BatchDeleteMessagesRequest().setIds(messageIds);
                execute(service -> service.users().messages().batchDelete(userId, delete).execute());
                break;
            default:
                throw new IllegalArgumentException("Unsupported action " + action);
        }
        return DisposalResult.allSucceeded(messageIds);
    }

    @Override
    public String ensureLabel(String name) throws IOException {
        String existing = findLabelId(name);
        if (existing != null) {
            return existing;
        }

        Label label = new Label()
            .setName(name)
            .setLabelListVisibility("labelShow")
            .setMessageListVisibility("show");
        try {
            Label created = execute(service -> service.users().labels().create(userId, label).execute());
            log.info("Created label `{}` ({})", name, created.getId());
            return created.getId();
        } catch (GoogleJsonResponseException e) {
            // 409: created concurrently by someone else
            if (e.getStatusCode() == 409) {
                String id = findLabelId(name);
                if (id != null) {
                    return id;
                }
            }
            throw e;
        }
    }

    @Override
    public void applyLabel(String labelId, List<String> messageIds) throws IOException {
        if (messageIds.isEmpty()) {
            return;
        }
        BatchModifyMessagesRequest mods = new BatchModifyMessagesRequest()
            .setIds(messageIds)
            .setAddLabelIds(Collections.singletonList(labelId))
            .setRemoveLabelIds(Collections.emptyList());
        execute(service -> service.users().messages().batchModify(userId, mods).execute());
    }

    @Override
    public MessageSummary getMessageSummary(String messageId) throws IOException {
        Message message = execute(service -> service.users().messages().get(userId, messageId)
            .setFormat("metadata")
            .setMetadataHeaders(Arrays.asList("Subject", "Date"))
            .execute());

        String subject = null;
        String date = null;
        if (message.getPayload() != null && message.getPayload().getHeaders() != null) {
            for (MessagePartHeader header : message.getPayload().getHeaders()) {
                if ("Subject".equalsIgnoreCase(header.getName())) {
                    subject = header.getValue();
                } else if ("Date".equalsIgnoreCase(header.getName())) {
                    date = header.getValue();
                }
            }
        }
        return new MessageSummary(messageId, date, subject);
    }

    private String findLabelId(String name) throws IOException {
        ListLabelsResponse response = execute(service -> service.users().labels().list(userId).execute());
        if (response.getLabels() == null) {
            return null;
        }
        for (Label label : response.getLabels()) {
            if (name.equals(label.getName())) {
                return label.getId();
            }
        }
        return null;
    }

    /**
     * Runs a Gmail call, refreshing the access token and retrying once on 401.
     */
    private <T> T execute(GmailCall<T> call) throws IOException {
        try {
            return call.apply(getGmailService(tokenRefreshService.ensureValidAccessToken()));
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() != 401) {
                throw e;
            }
            log.info("Received 401 from Gmail, refreshing token and retrying");
            return call.apply(getGmailService(tokenRefreshService.refreshTokenOn401()));
        }
    }

    @FunctionalInterface
    private interface GmailCall<T> {
        T apply(Gmail service) throws IOException;
    }
}
