package cafe.woden.huddle.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Wraps a {@link TopicEvent} with its topic and per-topic sequence number. */
@ValueObject
public record SequencedEvent(TopicRef topic, long seq, TopicEvent event) {
  public SequencedEvent {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(event, "event");
    if (seq <= 0) throw new IllegalArgumentException("seq must be positive: " + seq);
  }

  /** Identity behind a typing event, or null for every other event. */
  public String typingIdentity() {
    if (event instanceof TopicEvent.TypingStarted started) return started.identity();
    if (event instanceof TopicEvent.TypingStopped stopped) return stopped.identity();
    return null;
  }
}
