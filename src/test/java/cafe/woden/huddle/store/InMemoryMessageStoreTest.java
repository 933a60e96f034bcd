package cafe.woden.huddle.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.huddle.model.ChatMessage;
import cafe.woden.huddle.model.RealtimeException;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.model.TopicRef;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryMessageStoreTest {

  private static final TopicRef GENERAL = TopicRef.channel("general");
  private static final TopicRef RANDOM = TopicRef.channel("random");

  private InMemoryChannelDirectory directory;
  private InMemoryMessageStore store;

  @BeforeEach
  void setUp() {
    directory = new InMemoryChannelDirectory();
    directory.addWorkspaceMember("acme", "u1");
    directory.addWorkspaceMember("acme", "u2");
    directory.grantAdmin("acme", "boss");
    directory.putChannel("general", "acme", ChannelVisibility.PUBLIC);
    directory.putChannel("random", "acme", ChannelVisibility.PUBLIC);
    store =
        new InMemoryMessageStore(
            directory, Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void createAssignsIdsAndTrimsContent() {
    ChatMessage m = create(GENERAL, "u1", "  hello  ");

    assertEquals("m-1", m.id());
    assertEquals("hello", m.content());
    assertEquals(Instant.parse("2026-01-01T00:00:00Z"), m.createdAt());
    assertNull(m.editedAt());
  }

  @Test
  void blankContentWithoutAttachmentsIsInvalid() {
    store.createMessage(GENERAL, "u1", "   ", List.of()).test().assertError(invalid());
    store.createMessage(GENERAL, "u1", "", List.of("file-1")).test().assertComplete();
  }

  @Test
  void overlongContentIsInvalid() {
    String text = "x".repeat(InMemoryMessageStore.MAX_CONTENT_LENGTH + 1);
    store.createMessage(GENERAL, "u1", text, List.of()).test().assertError(invalid());
  }

  @Test
  void onlyTheAuthorMayEdit() {
    ChatMessage m = create(GENERAL, "u1", "first");

    store
        .editMessage(GENERAL, m.id(), "u2", "hijack")
        .test()
        .assertError(e -> ((RealtimeException) e).reason().equals("unauthorized"));

    TopicEvent.MessageEdited edited =
        store.editMessage(GENERAL, m.id(), "u1", "second").blockingGet();
    assertEquals("second", edited.message().content());
    assertNotNull(edited.message().editedAt());
    assertEquals("second", store.listRecent(GENERAL, 10).blockingGet().get(0).content());
  }

  @Test
  void authorOrWorkspaceAdminMayDelete() {
    ChatMessage mine = create(GENERAL, "u1", "mine");
    ChatMessage other = create(GENERAL, "u1", "other");

    store
        .deleteMessage(GENERAL, mine.id(), "u2")
        .test()
        .assertError(e -> ((RealtimeException) e).reason().equals("unauthorized"));
    store.deleteMessage(GENERAL, mine.id(), "u1").test().assertComplete();
    store.deleteMessage(GENERAL, other.id(), "boss").test().assertComplete();

    assertTrue(store.listRecent(GENERAL, 10).blockingGet().isEmpty());
  }

  @Test
  void messagesAreScopedToTheirTopic() {
    ChatMessage m = create(GENERAL, "u1", "hi");

    store
        .editMessage(RANDOM, m.id(), "u1", "moved")
        .test()
        .assertError(e -> ((RealtimeException) e).reason().equals("not_found"));
  }

  @Test
  void reactionsCannotBeDuplicatedAndMustExistToBeRemoved() {
    ChatMessage m = create(GENERAL, "u1", "hi");

    store.addReaction(GENERAL, m.id(), "u2", ":+1:").test().assertComplete();
    store.addReaction(GENERAL, m.id(), "u2", ":+1:").test().assertError(invalid());
    store.removeReaction(GENERAL, m.id(), "u2", ":+1:").test().assertComplete();
    store
        .removeReaction(GENERAL, m.id(), "u2", ":+1:")
        .test()
        .assertError(e -> ((RealtimeException) e).reason().equals("not_found"));
  }

  @Test
  void threadRepliesStayOutOfTheTimeline() {
    ChatMessage parent = create(GENERAL, "u1", "question");

    TopicEvent.ThreadReplyCreated reply =
        store.createThreadReply(GENERAL, parent.id(), "u2", "answer", List.of()).blockingGet();

    assertEquals(parent.id(), reply.parentId());
    assertTrue(reply.reply().isThreadReply());
    assertEquals(List.of(parent), store.listRecent(GENERAL, 10).blockingGet());
    store
        .createThreadReply(GENERAL, reply.reply().id(), "u1", "nested", List.of())
        .test()
        .assertError(invalid());
  }

  @Test
  void markReadRemembersLastReadMessage() {
    ChatMessage m = create(GENERAL, "u1", "hi");

    TopicEvent.MessageRead read = store.markRead(GENERAL, m.id(), "u2").blockingGet();

    assertEquals(m.id(), read.messageId());
    assertEquals(m.id(), store.lastRead(GENERAL, "u2"));
    assertNull(store.lastRead(GENERAL, "u1"));
  }

  @Test
  void listRecentReturnsTheNewestOldestFirst() {
    for (int i = 1; i <= 5; i++) create(GENERAL, "u1", "msg " + i);

    List<ChatMessage> recent = store.listRecent(GENERAL, 3).blockingGet();

    assertEquals(
        List.of("msg 3", "msg 4", "msg 5"), recent.stream().map(ChatMessage::content).toList());
  }

  @Test
  void listBeforePagesBackwardsFromAnAnchor() {
    for (int i = 1; i <= 5; i++) create(GENERAL, "u1", "msg " + i);

    List<ChatMessage> older = store.listBefore(GENERAL, "m-4", 2).blockingGet();

    assertEquals(List.of("msg 2", "msg 3"), older.stream().map(ChatMessage::content).toList());
    assertTrue(store.listBefore(GENERAL, "m-1", 2).blockingGet().isEmpty());
    store
        .listBefore(GENERAL, "m-99", 2)
        .test()
        .assertError(e -> ((RealtimeException) e).reason().equals("not_found"));
  }

  private ChatMessage create(TopicRef topic, String author, String content) {
    return store.createMessage(topic, author, content, List.of()).blockingGet().message();
  }

  private static io.reactivex.rxjava3.functions.Predicate<Throwable> invalid() {
    return e -> e instanceof RealtimeException re && re.reason().equals("invalid");
  }
}
