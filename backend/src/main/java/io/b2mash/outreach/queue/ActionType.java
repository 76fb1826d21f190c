package io.b2mash.outreach.queue;

import io.b2mash.outreach.health.SendEventType;
import io.b2mash.outreach.pool.Channel;

/** Kind of outbound action. Each type goes out on exactly one channel. */
public enum ActionType {
  CONNECTION_REQUEST(Channel.LINKEDIN, SendEventType.CONNECTION_REQUESTED),
  MESSAGE(Channel.LINKEDIN, SendEventType.SENT),
  EMAIL(Channel.EMAIL, SendEventType.SENT),
  SMS(Channel.SMS, SendEventType.SENT),
  VOICE_CALL(Channel.VOICE, SendEventType.SENT);

  private final Channel channel;
  private final SendEventType sendEventType;

  ActionType(Channel channel, SendEventType sendEventType) {
    this.channel = channel;
    this.sendEventType = sendEventType;
  }

  public Channel channel() {
    return channel;
  }

  /** Event reported to the health windows when an action of this type is delivered. */
  public SendEventType sendEventType() {
    return sendEventType;
  }
}
