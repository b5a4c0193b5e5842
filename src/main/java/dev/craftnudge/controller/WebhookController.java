package dev.craftnudge.controller;

import dev.craftnudge.exception.AuthenticationFailedException;
import dev.craftnudge.service.NotificationReceiver;
import dev.craftnudge.service.ReceiveResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * GitHub webhook receiver. Authenticates, queues and answers without waiting
 * for any processing.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private final NotificationReceiver receiver;

    public WebhookController(NotificationReceiver receiver) {
        this.receiver = receiver;
    }

    @PostMapping("/github")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody byte[] rawBody) {

        ReceiveResult result;
        try {
            result = receiver.receive(signature, deliveryId, eventType, rawBody);
        } catch (AuthenticationFailedException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "rejected", "reason", e.getMessage()));
        }

        return switch (result.status()) {
            case QUEUED -> ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("status", "queued", "eventId", result.eventId().toString()));
            case DUPLICATE -> ResponseEntity.ok(Map.of("status", "duplicate", "eventId", result.eventId().toString()));
            case IGNORED -> ResponseEntity.ok(Map.of("status", "ignored",
                    "reason", "event type not ingested: " + (eventType == null ? "unknown" : eventType)));
        };
    }
}
