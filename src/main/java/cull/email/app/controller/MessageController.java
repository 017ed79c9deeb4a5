package cull.email.app.controller;

import cull.email.app.entity.DisposalAction;
import cull.email.app.entity.MessageDisposalReport;
import cull.email.app.entity.MessageSummary;
import cull.email.app.entity.RunMode;
import cull.email.app.service.MessageQuery;
import cull.email.app.service.MessageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;

/**
 * List, trash or delete messages selected by labels and a Gmail query.
 * Trash and delete default to a dry run.
 */
@Slf4j
@RestController
@RequestMapping("/api/messages")
public class MessageController {
    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    @GetMapping
    public List<MessageSummary> listMessages(
            @RequestParam(name = "label", required = false) List<String> labels,
            @RequestParam(required = false) String query,
            @RequestParam(defaultValue = "200") int maxResults,
            @RequestParam(defaultValue = "1") int pages) throws IOException {
        return messageService.listMessages(messageQuery(labels, query, maxResults, pages));
    }

    @PostMapping("/{action}")
    public MessageDisposalReport disposeMessages(
            @PathVariable String action,
            @RequestParam(name = "label", required = false) List<String> labels,
            @RequestParam(required = false) String query,
            @RequestParam(defaultValue = "200") int maxResults,
            @RequestParam(defaultValue = "1") int pages,
            @RequestParam(defaultValue = "false") boolean execute) {
        DisposalAction disposalAction = DisposalAction.parse(action);
        log.info("Message {} requested: labels={}, query={}, execute={}", disposalAction, labels, query, execute);
        return messageService.dispose(messageQuery(labels, query, maxResults, pages), disposalAction,
            execute ? RunMode.EXECUTE : RunMode.DRY_RUN);
    }

    private static MessageQuery messageQuery(List<String> labels, String query, int maxResults, int pages) {
        MessageQuery.MessageQueryBuilder builder = MessageQuery.builder()
            .query(query)
            .maxResults(maxResults)
            .maxPages(pages);
        if (labels != null) {
            builder.labels(labels);
        }
        return builder.build();
    }
}
