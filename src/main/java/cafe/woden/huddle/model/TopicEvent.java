package cafe.woden.huddle.model;

/**
 * Domain events published to a topic.
 *
 * <p>Events are immutable. Sequence numbers are assigned at publish time and travel alongside in
 * {@link SequencedEvent}; the event itself never carries one.
 */
public sealed interface TopicEvent
    permits TopicEvent.MessageCreated,
        TopicEvent.MessageEdited,
        TopicEvent.MessageDeleted,
        TopicEvent.ReactionAdded,
        TopicEvent.ReactionRemoved,
        TopicEvent.ThreadReplyCreated,
        TopicEvent.MessageRead,
        TopicEvent.TypingStarted,
        TopicEvent.TypingStopped,
        TopicEvent.PresenceDiffed {

  /** Wire event name, e.g. {@code message_created}. */
  String eventName();

  record MessageCreated(ChatMessage message) implements TopicEvent {
    @Override
    public String eventName() {
      return "message_created";
    }
  }

  record MessageEdited(ChatMessage message) implements TopicEvent {
    @Override
    public String eventName() {
      return "message_edited";
    }
  }

  record MessageDeleted(ChatMessage message) implements TopicEvent {
    @Override
    public String eventName() {
      return "message_deleted";
    }
  }

  record ReactionAdded(String messageId, String emoji, String identity) implements TopicEvent {
    @Override
    public String eventName() {
      return "reaction_added";
    }
  }

  record ReactionRemoved(String messageId, String emoji, String identity) implements TopicEvent {
    @Override
    public String eventName() {
      return "reaction_removed";
    }
  }

  record ThreadReplyCreated(String parentId, ChatMessage reply) implements TopicEvent {
    @Override
    public String eventName() {
      return "thread_reply_created";
    }
  }

  /** Read receipt: {@code identity} has read up to {@code messageId}. */
  record MessageRead(String messageId, String identity) implements TopicEvent {
    @Override
    public String eventName() {
      return "message_read";
    }
  }

  record TypingStarted(String identity) implements TopicEvent {
    @Override
    public String eventName() {
      return "typing_started";
    }
  }

  record TypingStopped(String identity) implements TopicEvent {
    @Override
    public String eventName() {
      return "typing_stopped";
    }
  }

  record PresenceDiffed(PresenceDiff diff) implements TopicEvent {
    @Override
    public String eventName() {
      return "presence_diff";
    }
  }
}
