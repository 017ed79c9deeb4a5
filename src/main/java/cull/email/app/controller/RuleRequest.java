package cull.email.app.controller;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /api/rules}.
 */
@Data
public class RuleRequest {
    /** Retention period token such as {@code m:6}. */
    private String age;
    private List<String> labels = new ArrayList<>();
    private String action = "trash";
    private boolean generateLabel = true;
}
