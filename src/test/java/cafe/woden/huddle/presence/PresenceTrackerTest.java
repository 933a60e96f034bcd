package cafe.woden.huddle.presence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.huddle.broadcast.TopicBroadcaster;
import cafe.woden.huddle.broadcast.TopicSubscriber;
import cafe.woden.huddle.model.PresenceDiff;
import cafe.woden.huddle.model.PresenceMeta;
import cafe.woden.huddle.model.PresenceStatus;
import cafe.woden.huddle.model.SequencedEvent;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.model.TopicRef;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PresenceTrackerTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private TopicBroadcaster broadcaster;
  private PresenceTracker tracker;
  private final List<SequencedEvent> published = new ArrayList<>();

  @BeforeEach
  void setUp() {
    broadcaster = new TopicBroadcaster(TopicRef.channel("general"), 0);
    broadcaster.subscribe(
        new TopicSubscriber() {
          @Override
          public String identity() {
            return "observer";
          }

          @Override
          public boolean offer(SequencedEvent event) {
            return published.add(event);
          }

          @Override
          public void onOverflow() {}
        },
        1);
    tracker = new PresenceTracker(broadcaster);
  }

  @Test
  void firstDeviceJoinsAndLastDeviceLeaves() {
    PresenceMeta phone = meta("phone");
    PresenceMeta laptop = meta("laptop");

    assertEquals(PresenceDiff.join("u1", phone), tracker.track("u1", phone));
    assertEquals(PresenceDiff.join("u1", laptop), tracker.track("u1", laptop));
    assertEquals(2, tracker.metaCount());

    assertEquals(PresenceDiff.leave("u1", phone), tracker.untrack("u1", "phone"));
    assertTrue(tracker.isPresent("u1"));
    assertEquals(PresenceDiff.leave("u1", laptop), tracker.untrack("u1", "laptop"));
    assertFalse(tracker.isPresent("u1"));
    assertEquals(Map.of(), tracker.snapshot());
  }

  @Test
  void everyChangePublishesItsDiff() {
    tracker.track("u1", meta("phone"));
    tracker.untrack("u1", "phone");

    assertEquals(2, published.size());
    PresenceDiff first =
        assertInstanceOf(TopicEvent.PresenceDiffed.class, published.get(0).event()).diff();
    assertEquals(List.of(meta("phone")), first.joins().get("u1"));
  }

  @Test
  void noOpCallsPublishNothing() {
    tracker.track("u1", meta("phone"));
    published.clear();

    assertTrue(tracker.untrack("u1", "tablet").isEmpty());
    assertTrue(tracker.untrack("ghost", "phone").isEmpty());
    assertTrue(tracker.updateStatus("u1", "phone", PresenceStatus.ONLINE).isEmpty());
    assertTrue(tracker.track("u1", meta("phone")).isEmpty());
    assertTrue(published.isEmpty());
  }

  @Test
  void retrackingADeviceReplacesItsMeta() {
    PresenceMeta before = meta("phone");
    PresenceMeta after = new PresenceMeta("phone", PresenceStatus.ONLINE, T0.plusSeconds(60));
    tracker.track("u1", before);

    PresenceDiff diff = tracker.track("u1", after);

    assertEquals(PresenceDiff.replace("u1", before, after), diff);
    assertEquals(Map.of("u1", List.of(after)), tracker.snapshot());
  }

  @Test
  void statusUpdateIsReportedAsLeaveOldJoinNew() {
    PresenceMeta online = meta("phone");
    tracker.track("u1", online);

    PresenceDiff diff = tracker.updateStatus("u1", "phone", PresenceStatus.AWAY);

    assertEquals(List.of(online), diff.leaves().get("u1"));
    assertEquals(List.of(online.withStatus(PresenceStatus.AWAY)), diff.joins().get("u1"));
    assertEquals(PresenceStatus.AWAY, tracker.snapshot().get("u1").get(0).status());
  }

  private static PresenceMeta meta(String device) {
    return new PresenceMeta(device, PresenceStatus.ONLINE, T0);
  }
}
