package com.ai.autoreply.controller;

import com.ai.autoreply.dto.WebhookEvent;
import com.ai.autoreply.dto.WebhookOutcome;
import com.ai.autoreply.service.InboundMessageOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway webhook. Recoverable conditions always answer 200 so the gateway does not redeliver.
 */
@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    static final String MESSAGES_UPSERT = "messages.upsert";

    private final InboundMessageOrchestrator orchestrator;

    public WebhookController(InboundMessageOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/webhook/{instanceName}")
    public ResponseEntity<WebhookOutcome> receive(@PathVariable String instanceName,
                                                  @RequestBody(required = false) WebhookEvent event) {
        if (event == null || event.getData() == null) {
            return ResponseEntity.ok(WebhookOutcome.ignored("no_data"));
        }
        if (event.getEvent() != null && !MESSAGES_UPSERT.equalsIgnoreCase(event.getEvent().replace('_', '.'))) {
            log.debug("Ignoring {} event for instance {}", event.getEvent(), instanceName);
            return ResponseEntity.ok(WebhookOutcome.ignored("unsupported_event"));
        }
        WebhookOutcome outcome = orchestrator.handle(instanceName, event);
        log.info("Webhook {} message {} -> {} ({})", instanceName, event.messageId(), outcome.getStatus(), outcome.getReason());
        return ResponseEntity.ok(outcome);
    }
}
