package cull.email.app.controller;

import cull.email.app.entity.DisposalAction;
import cull.email.app.service.RuleConfigurationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Manage retention rules. Every change is written to the rules file.
 */
@Slf4j
@RestController
@RequestMapping("/api/rules")
public class RuleController {
    private final RuleConfigurationService ruleConfigurationService;

    public RuleController(RuleConfigurationService ruleConfigurationService) {
        this.ruleConfigurationService = ruleConfigurationService;
    }

    @GetMapping
    public List<RuleResponse> listRules() {
        return ruleConfigurationService.listRules().stream()
            .map(RuleResponse::from)
            .collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public RuleResponse getRule(@PathVariable long id) {
        return RuleResponse.from(ruleConfigurationService.getRule(id));
    }

    @PostMapping
    public ResponseEntity<RuleResponse> addRule(@RequestBody RuleRequest request) {
        DisposalAction action = DisposalAction.parse(request.getAction());
        RuleResponse created = RuleResponse.from(ruleConfigurationService.addRule(
            request.getAge(), request.isGenerateLabel(), request.getLabels(), action));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @DeleteMapping("/{id}")
    public RuleResponse removeRule(@PathVariable long id) {
        return RuleResponse.from(ruleConfigurationService.removeRule(id));
    }

    @DeleteMapping(params = "label")
    public RuleResponse removeRuleByLabel(@RequestParam String label) {
        return RuleResponse.from(ruleConfigurationService.removeRuleByLabel(label));
    }

    @PostMapping("/{id}/labels/{label}")
    public RuleResponse addLabel(@PathVariable long id, @PathVariable String label) {
        return RuleResponse.from(ruleConfigurationService.addLabel(id, label));
    }

    @DeleteMapping("/{id}/labels/{label}")
    public RuleResponse removeLabel(@PathVariable long id, @PathVariable String label) {
        return RuleResponse.from(ruleConfigurationService.removeLabel(id, label));
    }

    @PutMapping("/{id}/action/{action}")
    public RuleResponse setAction(@PathVariable long id, @PathVariable String action) {
        return RuleResponse.from(ruleConfigurationService.setAction(id, DisposalAction.parse(action)));
    }
}
