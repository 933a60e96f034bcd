package cafe.woden.huddle.store;

import cafe.woden.huddle.model.ChatMessage;
import cafe.woden.huddle.model.RealtimeException;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.model.TopicRef;
import io.reactivex.rxjava3.core.Single;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link MessageStore}.
 *
 * <p>Keeps one ordered timeline of top-level messages per topic; thread replies are held beside it
 * and never appear in {@link #listRecent}. Only a message's author may edit it; the author or a
 * workspace admin may delete it.
 */
@Component
@InfrastructureLayer
public class InMemoryMessageStore implements MessageStore {

  static final int MAX_CONTENT_LENGTH = 4_000;

  private final ChannelDirectory directory;
  private final Clock clock;
  private final AtomicLong ids = new AtomicLong();

  private final Map<TopicRef, List<ChatMessage>> timelineByTopic = new HashMap<>();
  private final Map<String, ChatMessage> byId = new HashMap<>();
  private final Map<String, Map<String, Set<String>>> reactionsByMessage = new HashMap<>();
  private final Map<String, Map<String, String>> lastReadByTopicAndIdentity = new HashMap<>();

  @Autowired
  public InMemoryMessageStore(ChannelDirectory directory) {
    this(directory, Clock.systemUTC());
  }

  InMemoryMessageStore(ChannelDirectory directory, Clock clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Single<TopicEvent.MessageCreated> createMessage(
      TopicRef topic, String authorId, String content, List<String> attachments) {
    return Single.fromCallable(
        () -> {
          String text = requireContent(content, attachments);
          synchronized (this) {
            ChatMessage message =
                new ChatMessage(
                    nextId(), topic, authorId, text, attachments, null, clock.instant(), null);
            timelineByTopic.computeIfAbsent(topic, k -> new ArrayList<>()).add(message);
            byId.put(message.id(), message);
            return new TopicEvent.MessageCreated(message);
          }
        });
  }

  @Override
  public Single<TopicEvent.MessageEdited> editMessage(
      TopicRef topic, String messageId, String editorId, String content) {
    return Single.fromCallable(
        () -> {
          String text = requireContent(content, List.of());
          synchronized (this) {
            ChatMessage current = requireMessage(topic, messageId);
            if (!current.authorId().equals(editorId)) {
              throw RealtimeException.unauthorized("only the author may edit " + messageId);
            }
            ChatMessage edited = current.withContent(text, clock.instant());
            replace(edited);
            return new TopicEvent.MessageEdited(edited);
          }
        });
  }

  @Override
  public Single<TopicEvent.MessageDeleted> deleteMessage(
      TopicRef topic, String messageId, String requesterId) {
    return Single.fromCallable(
        () -> {
          synchronized (this) {
            ChatMessage current = requireMessage(topic, messageId);
            if (!current.authorId().equals(requesterId) && !isWorkspaceAdmin(requesterId, topic)) {
              throw RealtimeException.unauthorized("not allowed to delete " + messageId);
            }
            byId.remove(current.id());
            reactionsByMessage.remove(current.id());
            List<ChatMessage> timeline = timelineByTopic.get(topic);
            if (timeline != null) timeline.removeIf(m -> m.id().equals(current.id()));
            return new TopicEvent.MessageDeleted(current);
          }
        });
  }

  @Override
  public Single<TopicEvent.ReactionAdded> addReaction(
      TopicRef topic, String messageId, String identity, String emoji) {
    return Single.fromCallable(
        () -> {
          String e = requireEmoji(emoji);
          synchronized (this) {
            requireMessage(topic, messageId);
            Set<String> reactors =
                reactionsByMessage
                    .computeIfAbsent(messageId, k -> new LinkedHashMap<>())
                    .computeIfAbsent(e, k -> new LinkedHashSet<>());
            if (!reactors.add(identity)) {
              throw RealtimeException.invalid("reaction already present");
            }
            return new TopicEvent.ReactionAdded(messageId, e, identity);
          }
        });
  }

  @Override
  public Single<TopicEvent.ReactionRemoved> removeReaction(
      TopicRef topic, String messageId, String identity, String emoji) {
    return Single.fromCallable(
        () -> {
          String e = requireEmoji(emoji);
          synchronized (this) {
            requireMessage(topic, messageId);
            Map<String, Set<String>> byEmoji = reactionsByMessage.get(messageId);
            Set<String> reactors = byEmoji == null ? null : byEmoji.get(e);
            if (reactors == null || !reactors.remove(identity)) {
              throw RealtimeException.notFound("no " + e + " reaction by " + identity);
            }
            if (reactors.isEmpty()) byEmoji.remove(e);
            return new TopicEvent.ReactionRemoved(messageId, e, identity);
          }
        });
  }

  @Override
  public Single<TopicEvent.ThreadReplyCreated> createThreadReply(
      TopicRef topic, String parentId, String authorId, String content, List<String> attachments) {
    return Single.fromCallable(
        () -> {
          String text = requireContent(content, attachments);
          synchronized (this) {
            ChatMessage parent = requireMessage(topic, parentId);
            if (parent.isThreadReply()) {
              throw RealtimeException.invalid("replies cannot start a thread");
            }
            ChatMessage reply =
                new ChatMessage(
                    nextId(),
                    topic,
                    authorId,
                    text,
                    attachments,
                    parent.id(),
                    clock.instant(),
                    null);
            byId.put(reply.id(), reply);
            return new TopicEvent.ThreadReplyCreated(parent.id(), reply);
          }
        });
  }

  @Override
  public Single<TopicEvent.MessageRead> markRead(
      TopicRef topic, String messageId, String identity) {
    return Single.fromCallable(
        () -> {
          synchronized (this) {
            requireMessage(topic, messageId);
            lastReadByTopicAndIdentity
                .computeIfAbsent(topic.value(), k -> new HashMap<>())
                .put(identity, messageId);
            return new TopicEvent.MessageRead(messageId, identity);
          }
        });
  }

  @Override
  public Single<List<ChatMessage>> listRecent(TopicRef topic, int limit) {
    return Single.fromCallable(
        () -> {
          synchronized (this) {
            List<ChatMessage> timeline = timelineByTopic.getOrDefault(topic, List.of());
            int from = Math.max(0, timeline.size() - Math.max(0, limit));
            return List.copyOf(timeline.subList(from, timeline.size()));
          }
        });
  }

  @Override
  public Single<List<ChatMessage>> listBefore(TopicRef topic, String beforeId, int limit) {
    return Single.fromCallable(
        () -> {
          synchronized (this) {
            ChatMessage anchor = requireMessage(topic, beforeId);
            List<ChatMessage> timeline = timelineByTopic.getOrDefault(topic, List.of());
            int end = 0;
            for (int i = 0; i < timeline.size(); i++) {
              if (timeline.get(i).id().equals(anchor.id())) {
                end = i;
                break;
              }
            }
            int from = Math.max(0, end - Math.max(0, limit));
            return List.copyOf(timeline.subList(from, end));
          }
        });
  }

  /** Last message {@code identity} marked as read in {@code topic}, or null. */
  public synchronized String lastRead(TopicRef topic, String identity) {
    Map<String, String> byIdentity = lastReadByTopicAndIdentity.get(topic.value());
    return byIdentity == null ? null : byIdentity.get(identity);
  }

  private String nextId() {
    return "m-" + ids.incrementAndGet();
  }

  private ChatMessage requireMessage(TopicRef topic, String messageId) {
    String id = Objects.toString(messageId, "").trim();
    if (id.isEmpty()) throw RealtimeException.invalid("message_id is required");
    ChatMessage message = byId.get(id);
    if (message == null || !message.topic().equals(topic)) {
      throw RealtimeException.notFound("unknown message " + id);
    }
    return message;
  }

  private void replace(ChatMessage updated) {
    byId.put(updated.id(), updated);
    if (updated.isThreadReply()) return;
    List<ChatMessage> timeline = timelineByTopic.get(updated.topic());
    if (timeline == null) return;
    for (int i = 0; i < timeline.size(); i++) {
      if (timeline.get(i).id().equals(updated.id())) {
        timeline.set(i, updated);
        return;
      }
    }
  }

  private boolean isWorkspaceAdmin(String identity, TopicRef topic) {
    String workspaceId =
        topic.isWorkspace() ? topic.id() : directory.workspaceOf(topic).orElse(null);
    return workspaceId != null && directory.isAdmin(identity, workspaceId);
  }

  private static String requireContent(String content, List<String> attachments) {
    String text = Objects.toString(content, "").trim();
    boolean hasAttachments = attachments != null && !attachments.isEmpty();
    if (text.isEmpty() && !hasAttachments) {
      throw RealtimeException.invalid("content must not be blank");
    }
    if (text.length() > MAX_CONTENT_LENGTH) {
      throw RealtimeException.invalid("content exceeds " + MAX_CONTENT_LENGTH + " characters");
    }
    return text;
  }

  private static String requireEmoji(String emoji) {
    String e = Objects.toString(emoji, "").trim();
    if (e.isEmpty()) throw RealtimeException.invalid("emoji is required");
    return e;
  }
}
