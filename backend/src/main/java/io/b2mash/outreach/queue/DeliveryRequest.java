package io.b2mash.outreach.queue;

import java.util.UUID;

/** What a delivery provider needs to perform one action. */
public record DeliveryRequest(
    UUID actionId,
    UUID tenantId,
    UUID resourceId,
    String resourceValue,
    UUID leadId,
    ActionType actionType,
    String payloadRef) {}
