package io.b2mash.outreach.queue;

/** A delivery provider could not perform an action. Always retried with backoff by the queue. */
public class DeliveryProviderException extends Exception {

  public DeliveryProviderException(String message) {
    super(message);
  }

  public DeliveryProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
