package io.b2mash.outreach.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polling loop of this instance. Any number of instances may run it against the same database;
 * the skip-locked claim keeps them from working the same item.
 */
@Component
public class ActionWorker {

  private static final Logger log = LoggerFactory.getLogger(ActionWorker.class);

  private final ActionDispatcher dispatcher;
  private final QueueProperties properties;

  public ActionWorker(ActionDispatcher dispatcher, QueueProperties properties) {
    this.dispatcher = dispatcher;
    this.properties = properties;
  }

  @Scheduled(fixedDelayString = "${outreach.queue.poll-interval:PT15S}")
  public void poll() {
    if (!properties.workerEnabled()) {
      return;
    }
    var results = dispatcher.drain(null, properties.workerId(), properties.batchSize());
    if (!results.isEmpty()) {
      log.info("Worker {} dispatch pass: {}", properties.workerId(), results);
    }
  }
}
