package io.b2mash.outreach.queue;

/**
 * Port to the external system that actually sends an action (mail relay, LinkedIn automation,
 * telephony). Called by {@link ActionDispatcher} outside of any transaction.
 */
public interface DeliveryProvider {

  /** Provider identifier (e.g., "noop"). */
  String providerId();

  DeliveryReceipt deliver(DeliveryRequest request) throws DeliveryProviderException;
}
