package cull.email.app.service;

import cull.email.app.entity.SearchPage;
import cull.email.app.exception.EnumerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pages through Gmail search results and collects the matching message ids.
 */
@Slf4j
@Service
public class MessageEnumerator {
    private final GmailApiService gmailApiService;

    public MessageEnumerator(GmailApiService gmailApiService) {
        this.gmailApiService = gmailApiService;
    }

    /**
     * Collect ids matching a query, in the order Gmail returns them, without duplicates.
     * @param query Gmail search query
     * @param pageSize ids requested per page, must be positive
     * @param maxPages page limit, 0 to read until Gmail reports no further page
     * @return ordered, distinct message ids; empty when nothing matches
     * @throws EnumerationException if a page fails; holds the ids read so far
     */
    public List<String> enumerate(String query, int pageSize, int maxPages) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages must be >= 0");
        }

        Set<String> ids = new LinkedHashSet<>();
        String pageToken = null;
        int page = 0;

        do {
            SearchPage result;
            try {
                result = gmailApiService.searchMessages(query, pageToken, pageSize);
            } catch (Exception e) {
                throw new EnumerationException(page, new ArrayList<>(ids), e);
            }

            int before = ids.size();
            ids.addAll(result.getMessageIds());
            int duplicates = result.getMessageIds().size() - (ids.size() - before);
            if (duplicates > 0) {
                log.debug("Page {} of `{}` repeated {} ids already seen", page, query, duplicates);
            }
            log.debug("Page {} of `{}` returned {} ids", page, query, result.getMessageIds().size());

            pageToken = result.getNextPageToken();
            page++;
        } while (pageToken != null && (maxPages == 0 || page < maxPages));

        if (pageToken != null) {
            log.info("Search `{}` capped at {} page(s), {} ids; more results exist", query, maxPages, ids.size());
        }

        if (ids.isEmpty()) {
            log.info("Search `{}` returned no messages", query);
        }
        return new ArrayList<>(ids);
    }
}
