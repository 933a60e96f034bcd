package cafe.woden.huddle.topic;

import cafe.woden.huddle.broadcast.TopicSubscriber;

/** A participant of a topic: a subscriber plus the device it tracks presence for. */
public interface TopicMember extends TopicSubscriber {

  String deviceId();

  /**
   * The topic's owner failed and {@code replacement} took over. The member is expected to join the
   * replacement again; nothing it held on the failed owner survives.
   */
  void onOwnerRestarted(TopicOwner replacement);
}
