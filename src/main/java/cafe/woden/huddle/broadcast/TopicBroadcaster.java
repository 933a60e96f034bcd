package cafe.woden.huddle.broadcast;

import cafe.woden.huddle.model.SequencedEvent;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.model.TopicRef;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered event stream for a single topic.
 *
 * <p>Assigns each published event the next sequence number (strictly increasing, no gaps) and
 * offers it to every subscriber in subscription order. A subscriber whose queue rejects an event is
 * removed and notified; the others still get the event. There is no replay: a subscriber sees only
 * events published after it subscribed.
 *
 * <p>Not thread-safe. The owning topic's inbox is the only caller.
 */
public final class TopicBroadcaster {
  private static final Logger log = LoggerFactory.getLogger(TopicBroadcaster.class);

  private final TopicRef topic;
  private final Map<Subscription, TopicSubscriber> subscribers = new LinkedHashMap<>();
  private long tailSeq;
  private long nextSubscriptionId;

  /**
   * @param initialSeq sequence number already used; the first published event gets {@code
   *     initialSeq + 1}
   */
  public TopicBroadcaster(TopicRef topic, long initialSeq) {
    this.topic = Objects.requireNonNull(topic, "topic");
    if (initialSeq < 0) throw new IllegalArgumentException("initialSeq must be >= 0");
    this.tailSeq = initialSeq;
  }

  public TopicRef topic() {
    return topic;
  }

  /** Last assigned sequence number, or the initial sequence if nothing was published yet. */
  public long tailSeq() {
    return tailSeq;
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  /**
   * Registers {@code subscriber} from the current tail.
   *
   * @param fromSeq must be {@code tailSeq() + 1}
   */
  public Subscription subscribe(TopicSubscriber subscriber, long fromSeq) {
    Objects.requireNonNull(subscriber, "subscriber");
    if (fromSeq != tailSeq + 1) {
      throw new IllegalArgumentException(
          "subscribe from " + fromSeq + " but next seq on " + topic + " is " + (tailSeq + 1));
    }
    Subscription sub = new Subscription(topic, ++nextSubscriptionId, fromSeq);
    subscribers.put(sub, subscriber);
    return sub;
  }

  /** Idempotent. Returns true if the subscription was still registered. */
  public boolean unsubscribe(Subscription subscription) {
    if (subscription == null) return false;
    return subscribers.remove(subscription) != null;
  }

  public SequencedEvent publish(TopicEvent event) {
    SequencedEvent sequenced = new SequencedEvent(topic, ++tailSeq, event);
    String typingIdentity = sequenced.typingIdentity();

    List<TopicSubscriber> overflowed = null;
    var it = subscribers.entrySet().iterator();
    while (it.hasNext()) {
      TopicSubscriber subscriber = it.next().getValue();
      if (typingIdentity != null && typingIdentity.equals(subscriber.identity())) continue;

      boolean accepted;
      try {
        accepted = subscriber.offer(sequenced);
      } catch (RuntimeException e) {
        log.error("[{}] subscriber {} failed to accept seq {}", topic, subscriber, tailSeq, e);
        accepted = false;
      }
      if (!accepted) {
        it.remove();
        if (overflowed == null) overflowed = new ArrayList<>(1);
        overflowed.add(subscriber);
      }
    }

    if (overflowed != null) {
      for (TopicSubscriber s : overflowed) {
        log.warn("[{}] dropping subscriber {} at seq {}: outbound queue full", topic, s, tailSeq);
        try {
          s.onOverflow();
        } catch (RuntimeException e) {
          log.error("[{}] overflow handler of {} failed", topic, s, e);
        }
      }
    }
    return sequenced;
  }
}
