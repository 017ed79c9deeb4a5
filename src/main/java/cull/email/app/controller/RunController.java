package cull.email.app.controller;

import cull.email.app.entity.RunMode;
import cull.email.app.entity.RunReport;
import cull.email.app.service.RuleConfigurationService;
import cull.email.app.service.RunOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Triggers a disposal pass. Defaults to a dry run; pass {@code execute=true}
 * to actually trash or delete messages.
 */
@Slf4j
@RestController
@RequestMapping("/api/rules")
public class RunController {
    private final RuleConfigurationService ruleConfigurationService;

    public RunController(RuleConfigurationService ruleConfigurationService) {
        this.ruleConfigurationService = ruleConfigurationService;
    }

    @PostMapping("/run")
    public RunReport run(
            @RequestParam(defaultValue = "false") boolean execute,
            @RequestParam(defaultValue = "false") boolean skipTrash,
            @RequestParam(defaultValue = "false") boolean skipDelete,
            @RequestParam(name = "ruleId", required = false) List<Long> ruleIds) {
        RunOptions.RunOptionsBuilder options = RunOptions.builder()
            .mode(execute ? RunMode.EXECUTE : RunMode.DRY_RUN)
            .skipTrash(skipTrash)
            .skipDelete(skipDelete);
        if (ruleIds != null) {
            options.ruleIds(ruleIds);
        }
        log.info("Run requested: execute={}, skipTrash={}, skipDelete={}, rules={}", execute, skipTrash,
            skipDelete, ruleIds == null ? "all" : ruleIds);
        return ruleConfigurationService.run(options.build());
    }
}
