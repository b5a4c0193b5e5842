package dev.craftnudge.service;

import dev.craftnudge.domain.enums.EventSource;
import dev.craftnudge.domain.event.EventReceivedEvent;
import dev.craftnudge.exception.AuthenticationFailedException;
import dev.craftnudge.infrastructure.github.WebhookSignatureVerifier;
import dev.craftnudge.store.EntityStore;
import dev.craftnudge.store.EventReceipt;
import dev.craftnudge.store.NewEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Accepts webhook deliveries: authenticate, persist the raw payload as a
 * PENDING event, return. Parsing and analysis happen later on the
 * dispatcher's workers.
 *
 * <p>Only {@code push} and {@code pull_request} deliveries are queued; other
 * event types (including {@code ping}) are acknowledged after authentication
 * and dropped.
 */
@Service
public class NotificationReceiver {
    private static final Logger log = LoggerFactory.getLogger(NotificationReceiver.class);

    // ingestion_events.delivery_id
    static final int MAX_DELIVERY_ID_LENGTH = 200;

    private final WebhookSignatureVerifier signatureVerifier;
    private final EntityStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public NotificationReceiver(WebhookSignatureVerifier signatureVerifier, EntityStore store,
                                ApplicationEventPublisher eventPublisher, Clock clock) {
        this.signatureVerifier = signatureVerifier;
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public ReceiveResult receive(String signature, String deliveryId, String eventType, byte[] rawPayload) {
        // Verify against raw bytes before anything else touches the body
        if (!signatureVerifier.isValid(rawPayload, signature)) {
            log.warn("Webhook signature verification failed for delivery={}", deliveryId);
            throw new AuthenticationFailedException("invalid signature");
        }

        if (eventType == null || !EventNormalizer.WEBHOOK_TYPES.contains(eventType)) {
            log.info("Ignoring {} delivery={}", eventType, deliveryId);
            return ReceiveResult.ignored();
        }

        if (deliveryId != null && deliveryId.length() > MAX_DELIVERY_ID_LENGTH)
            throw new IllegalArgumentException("X-GitHub-Delivery longer than " + MAX_DELIVERY_ID_LENGTH + " characters");

        EventReceipt receipt = store.recordEvent(new NewEvent(EventSource.WEBHOOK, deliveryId, eventType,
                new String(rawPayload, StandardCharsets.UTF_8)));
        if (receipt.duplicate()) {
            log.info("Duplicate delivery: {} → {}", deliveryId, receipt.eventId());
            return ReceiveResult.duplicate(receipt.eventId());
        }

        eventPublisher.publishEvent(new EventReceivedEvent(
                receipt.eventId(), EventSource.WEBHOOK, eventType, clock.instant()));
        log.info("Queued event {} for delivery={}", receipt.eventId(), deliveryId);
        return ReceiveResult.queued(receipt.eventId());
    }
}
