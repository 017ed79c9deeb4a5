package cull.email.app.controller;

import cull.email.app.entity.Rule;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RuleResponse {
    long id;
    String retention;
    boolean generateLabel;
    List<String> labels;
    String action;
    String description;

    public static RuleResponse from(Rule rule) {
        return RuleResponse.builder()
            .id(rule.getId())
            .retention(rule.getRetention().getAge().toToken())
            .generateLabel(rule.getRetention().isGenerateLabel())
            .labels(rule.getLabels())
            .action(rule.getAction().toString())
            .description(rule.describe())
            .build();
    }
}
