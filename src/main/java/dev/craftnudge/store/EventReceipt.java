package dev.craftnudge.store;

import java.util.UUID;

public record EventReceipt(UUID eventId, boolean duplicate) {
}
