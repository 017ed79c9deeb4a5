package cull.email.app.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ad-hoc message selection: labels and a raw Gmail query, combined with AND.
 */
@Value
@Builder
public class MessageQuery {
    @Singular
    List<String> labels;
    String query;
    /** Ids requested per search page. */
    @Builder.Default
    int maxResults = 200;
    /** Pages to read, 0 for all. */
    @Builder.Default
    int maxPages = 1;
}
