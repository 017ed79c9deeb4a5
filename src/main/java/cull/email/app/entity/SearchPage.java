package cull.email.app.entity;

import lombok.Value;

import java.util.List;

/**
 * One page of message search results. {@code nextPageToken} is null on the
 * last page.
 */
@Value
public class SearchPage {
    List<String> messageIds;
    String nextPageToken;

    public SearchPage(List<String> messageIds, String nextPageToken) {
        this.messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
        this.nextPageToken = nextPageToken == null || nextPageToken.isEmpty() ? null : nextPageToken;
    }

    public boolean hasNextPage() {
        return nextPageToken != null;
    }
}
