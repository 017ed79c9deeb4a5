package cull.email.app.exception;

import lombok.Getter;

import java.util.List;

/**
 * A search page failed. Carries the ids gathered from the pages before it;
 * they are never a complete result.
 */
@Getter
public class EnumerationException extends RetentionException {
    private final int pageIndex;
    private final List<String> partialIds;

    public EnumerationException(int pageIndex, List<String> partialIds, Throwable cause) {
        super("Message search failed on page " + pageIndex + " after " + partialIds.size()
            + " ids: " + cause.getMessage(), cause);
        this.pageIndex = pageIndex;
        this.partialIds = List.copyOf(partialIds);
    }
}
