package cafe.woden.huddle.broadcast;

import cafe.woden.huddle.model.SequencedEvent;

/** Receives a topic's events, in sequence order, from a {@link TopicBroadcaster}. */
public interface TopicSubscriber {

  /** Identity behind this subscriber. Typing events of the same identity are not delivered. */
  String identity();

  /**
   * Hands one event to the subscriber's outbound queue.
   *
   * @return false if the queue is full; the subscriber is then dropped and told via {@link
   *     #onOverflow()}
   */
  boolean offer(SequencedEvent event);

  /** Called once, after removal, when {@link #offer} rejected an event. */
  void onOverflow();
}
