package cull.email.app.service;

import cull.email.app.entity.DayConversion;
import cull.email.app.entity.RetentionPolicy;

import java.util.Collection;

/**
 * Turns a label and a retention policy into a Gmail search query.
 * <p>
 * {@code build("news", policy(m:6), null)} gives {@code label:news older_than:180d};
 * with an exclusion label {@code -label:<exclusion>} is appended.
 */
public class QueryBuilder {
    private final DayConversion dayConversion;

    public QueryBuilder() {
        this(DayConversion.DEFAULT);
    }

    public QueryBuilder(DayConversion dayConversion) {
        this.dayConversion = dayConversion;
    }

    public String build(String label, RetentionPolicy policy, String exclusionLabel) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label name must not be empty");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Retention policy is required");
        }

        StringBuilder query = new StringBuilder();
        query.append(labelTerm(label))
            .append(' ')
            .append(policy.getAge().render(dayConversion));

        if (exclusionLabel != null && !exclusionLabel.isBlank()) {
            query.append(" -").append(labelTerm(exclusionLabel));
        }
        return query.toString();
    }

    /**
     * Free-form search: one {@code label:} term per label followed by the raw
     * query, e.g. {@code label:promotions label:news older_than:3m}.
     * @return the combined query, empty when neither labels nor query are given
     */
    public String search(Collection<String> labels, String query) {
        StringBuilder search = new StringBuilder();
        if (labels != null) {
            for (String label : labels) {
                if (label == null || label.isBlank()) {
                    throw new IllegalArgumentException("Label name must not be empty");
                }
                if (search.length() > 0) {
                    search.append(' ');
                }
                search.append(labelTerm(label));
            }
        }
        if (query != null && !query.isBlank()) {
            if (search.length() > 0) {
                search.append(' ');
            }
            search.append(query.trim());
        }
        return search.toString();
    }

    public DayConversion getDayConversion() {
        return dayConversion;
    }

    private static String labelTerm(String label) {
        return "label:" + quoteIfNeeded(label);
    }

    private static String quoteIfNeeded(String value) {
        boolean needsQuotes = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '(' || c == ')' || c == '{' || c == '}') {
                needsQuotes = true;
                break;
            }
        }
        if (!needsQuotes) {
            return value;
        }
        return "\"" + value.replace("\"", "\\\"") + "\"";
    }
}
