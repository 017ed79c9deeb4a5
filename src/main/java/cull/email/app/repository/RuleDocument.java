package cull.email.app.repository;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the rules file.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleDocument {
    private Map<String, Entry> rules = new LinkedHashMap<>();

    @Data
    public static class Entry {
        private long id;
        private String retention;
        @JsonProperty("generate_label")
        private boolean generateLabel;
        private List<String> labels = new ArrayList<>();
        private String action;
    }
}
