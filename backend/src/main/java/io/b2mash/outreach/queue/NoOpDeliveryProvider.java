package io.b2mash.outreach.queue;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fallback provider used when no real one is configured. Logs the action instead of sending. */
public class NoOpDeliveryProvider implements DeliveryProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpDeliveryProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public DeliveryReceipt deliver(DeliveryRequest request) {
    log.info(
        "NoOp delivery: would perform {} for lead {} via {}",
        request.actionType(),
        request.leadId(),
        request.resourceValue());
    return new DeliveryReceipt("NOOP-" + UUID.randomUUID());
  }
}
