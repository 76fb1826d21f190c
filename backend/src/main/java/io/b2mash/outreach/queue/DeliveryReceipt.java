package io.b2mash.outreach.queue;

public record DeliveryReceipt(String providerReference) {}
