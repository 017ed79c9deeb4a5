package cull.email.app.service;

import cull.email.app.entity.MailboxLabel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Marker label name to Gmail label id. Shared by the chunks of one run, so it
 * must be safe for concurrent use; label creation is idempotent, so two
 * threads racing on the same name only cost an extra lookup.
 */
@Slf4j
@Component
public class MarkerLabelCache {
    private final GmailApiService gmailApiService;
    private final Map<String, String> labelIds = new ConcurrentHashMap<>();

    public MarkerLabelCache(GmailApiService gmailApiService) {
        this.gmailApiService = gmailApiService;
    }

    /**
     * Remember the existing labels whose names start with the marker prefix.
     */
    public void seed(Collection<MailboxLabel> labels, String markerPrefix) {
        for (MailboxLabel label : labels) {
            if (label.getName() != null && label.getName().startsWith(markerPrefix)) {
                labelIds.put(label.getName(), label.getId());
            }
        }
    }

    public Optional<String> find(String name) {
        return Optional.ofNullable(labelIds.get(name));
    }

    /**
     * Id of the marker label, creating it in the mailbox if needed.
     * @throws IOException if Gmail could not list or create the label
     */
    public String resolve(String name) throws IOException {
        try {
            return labelIds.computeIfAbsent(name, key -> {
                try {
                    String id = gmailApiService.ensureLabel(key);
                    log.info("Using marker label `{}` ({})", key, id);
                    return id;
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public void clear() {
        labelIds.clear();
    }

    public int size() {
        return labelIds.size();
    }
}
