package io.b2mash.outreach.queue;

/** Receives queue items that failed for good so that someone can look at them. */
public interface OperationalAlerts {

  void actionFailed(ActionQueueItem item);
}
