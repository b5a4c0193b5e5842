package dev.craftnudge.service;

import java.util.UUID;

/**
 * What the receiver did with an authenticated delivery. eventId is null for IGNORED.
 */
public record ReceiveResult(Status status, UUID eventId) {

    public enum Status { QUEUED, DUPLICATE, IGNORED }

    public static ReceiveResult queued(UUID eventId) { return new ReceiveResult(Status.QUEUED, eventId); }

    public static ReceiveResult duplicate(UUID eventId) { return new ReceiveResult(Status.DUPLICATE, eventId); }

    public static ReceiveResult ignored() { return new ReceiveResult(Status.IGNORED, null); }
}
