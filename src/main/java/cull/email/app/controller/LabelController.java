package cull.email.app.controller;

import cull.email.app.entity.MailboxLabel;
import cull.email.app.service.MessageService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/labels")
public class LabelController {
    private final MessageService messageService;

    public LabelController(MessageService messageService) {
        this.messageService = messageService;
    }

    @GetMapping
    public List<MailboxLabel> listLabels() throws IOException {
        return messageService.listLabels();
    }
}
