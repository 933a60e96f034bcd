package cafe.woden.huddle.session;

import cafe.woden.huddle.model.ChatMessage;
import cafe.woden.huddle.model.PresenceMeta;
import cafe.woden.huddle.model.SequencedEvent;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Everything a session sends to its client. Each push names the topic it belongs to. */
public sealed interface ServerPush
    permits ServerPush.Joined,
        ServerPush.Error,
        ServerPush.Event,
        ServerPush.OlderMessagesLoaded {

  String topic();

  /** Snapshot pushed once per (re)join, always before any event of that join. */
  record Joined(
      String topic, Map<String, List<PresenceMeta>> presence, List<ChatMessage> recentMessages)
      implements ServerPush {
    public Joined {
      presence = presence == null ? Map.of() : presence;
      recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
    }
  }

  record Error(String topic, String op, String reason, String clientRef) implements ServerPush {
    public Error {
      topic = Objects.toString(topic, "");
      op = Objects.toString(op, "");
    }
  }

  record Event(SequencedEvent event) implements ServerPush {
    public Event {
      Objects.requireNonNull(event, "event");
    }

    @Override
    public String topic() {
      return event.topic().value();
    }
  }

  record OlderMessagesLoaded(String topic, List<ChatMessage> messages, String clientRef)
      implements ServerPush {
    public OlderMessagesLoaded {
      messages = messages == null ? List.of() : List.copyOf(messages);
    }
  }
}
