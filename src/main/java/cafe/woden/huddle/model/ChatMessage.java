package cafe.woden.huddle.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A persisted chat message as handed back by the message store.
 *
 * <p>{@code parentId} is set for thread replies. {@code editedAt} is null until the first edit.
 */
@ValueObject
public record ChatMessage(
    String id,
    TopicRef topic,
    String authorId,
    String content,
    List<String> attachments,
    String parentId,
    Instant createdAt,
    Instant editedAt) {

  public ChatMessage {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(authorId, "authorId");
    content = Objects.toString(content, "");
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    if (createdAt == null) createdAt = Instant.EPOCH;
  }

  public boolean isThreadReply() {
    return parentId != null && !parentId.isBlank();
  }

  public ChatMessage withContent(String newContent, Instant at) {
    return new ChatMessage(id, topic, authorId, newContent, attachments, parentId, createdAt, at);
  }
}
