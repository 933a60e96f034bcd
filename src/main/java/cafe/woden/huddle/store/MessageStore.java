package cafe.woden.huddle.store;

import cafe.woden.huddle.model.ChatMessage;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.model.TopicRef;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Durable message persistence.
 *
 * <p>Every mutation resolves to the event that should be broadcast, or fails with a {@link
 * cafe.woden.huddle.model.RealtimeException} describing why (ownership, unknown message, invalid
 * payload). Any other failure is treated as a store failure by callers.
 */
@ApplicationLayer
public interface MessageStore {

  Single<TopicEvent.MessageCreated> createMessage(
      TopicRef topic, String authorId, String content, List<String> attachments);

  Single<TopicEvent.MessageEdited> editMessage(
      TopicRef topic, String messageId, String editorId, String content);

  Single<TopicEvent.MessageDeleted> deleteMessage(
      TopicRef topic, String messageId, String requesterId);

  Single<TopicEvent.ReactionAdded> addReaction(
      TopicRef topic, String messageId, String identity, String emoji);

  Single<TopicEvent.ReactionRemoved> removeReaction(
      TopicRef topic, String messageId, String identity, String emoji);

  Single<TopicEvent.ThreadReplyCreated> createThreadReply(
      TopicRef topic, String parentId, String authorId, String content, List<String> attachments);

  Single<TopicEvent.MessageRead> markRead(TopicRef topic, String messageId, String identity);

  /** Most recent top-level messages, oldest first. */
  Single<List<ChatMessage>> listRecent(TopicRef topic, int limit);

  /** Top-level messages strictly older than {@code beforeId}, oldest first. */
  Single<List<ChatMessage>> listBefore(TopicRef topic, String beforeId, int limit);
}
