package cafe.woden.huddle.topic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.huddle.model.PresenceMeta;
import cafe.woden.huddle.model.PresenceStatus;
import cafe.woden.huddle.model.RealtimeException;
import cafe.woden.huddle.model.SequencedEvent;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.model.TopicRef;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TopicOwnerTest {

  private static final TopicRef TOPIC = TopicRef.channel("general");

  private TestScheduler scheduler;
  private final List<Long> failedTails = new ArrayList<>();
  private TopicOwner owner;

  @BeforeEach
  void setUp() {
    scheduler = new TestScheduler();
    owner =
        new TopicOwner(
            TOPIC,
            0,
            scheduler,
            Duration.ofSeconds(5),
            (failed, tail, cause) -> failedTails.add(tail));
  }

  @Test
  void joinTracksAndSubscribesInOneTurn() {
    FakeMember u1 = new FakeMember("u1", "d1");
    FakeMember u2 = new FakeMember("u2", "d2");

    JoinTicket t1 = join(u1);
    JoinTicket t2 = join(u2);

    assertEquals(List.of("u1"), List.copyOf(t1.presence().keySet()));
    assertEquals(List.of("u1", "u2"), List.copyOf(t2.presence().keySet()));
    // u1 saw u2 arrive; u2 saw nothing of its own join.
    assertEquals(List.of("presence_diff"), u1.names());
    assertTrue(u2.events.isEmpty());
    assertEquals(3, t2.subscription().fromSeq());
  }

  @Test
  void tasksDoNotRunUntilTheInboxGetsToThem() {
    FakeMember u1 = new FakeMember("u1", "d1");
    TestObserver<JoinTicket> join = owner.join(u1, meta("d1")).test();

    join.assertNotComplete();
    scheduler.triggerActions();
    join.assertComplete();
  }

  @Test
  void leaveUntracksAndStopsOwnedTyping() {
    FakeMember u1 = new FakeMember("u1", "d1");
    FakeMember u2 = new FakeMember("u2", "d2");
    join(u1);
    join(u2);
    owner.typingStart("u2").test();
    scheduler.triggerActions();
    u1.events.clear();

    owner.leave(u2, true).test();
    scheduler.triggerActions();

    assertEquals(List.of("typing_stopped", "presence_diff"), u1.names());
    scheduler.advanceTimeBy(10, TimeUnit.SECONDS);
    assertEquals(2, u1.events.size());
  }

  @Test
  void leaveOfUnknownMemberIsIgnored() {
    FakeMember u1 = new FakeMember("u1", "d1");
    TestObserver<Void> leave = owner.leave(u1, true).test();
    scheduler.triggerActions();
    leave.assertComplete();
  }

  @Test
  void staleConnectionLeavingKeepsTheReplacingDevicePresent() {
    FakeMember watcher = new FakeMember("u2", "d2");
    FakeMember stale = new FakeMember("u1", "phone");
    FakeMember fresh = new FakeMember("u1", "phone");
    join(watcher);
    join(stale);
    join(fresh);
    watcher.events.clear();

    owner.leave(stale, true).test();
    TestObserver<Map<String, List<PresenceMeta>>> snapshot = owner.presenceSnapshot().test();
    scheduler.triggerActions();

    snapshot.assertValue(p -> p.keySet().equals(Set.of("u1", "u2")));
    assertTrue(watcher.events.isEmpty());

    owner.leave(fresh, true).test();
    TestObserver<Map<String, List<PresenceMeta>>> after = owner.presenceSnapshot().test();
    scheduler.triggerActions();

    after.assertValue(p -> p.keySet().equals(Set.of("u2")));
    assertEquals(List.of("presence_diff"), watcher.names());
  }

  @Test
  void publishAssignsTheNextSequence() {
    FakeMember u1 = new FakeMember("u1", "d1");
    join(u1);

    TestObserver<SequencedEvent> published =
        owner.publish(new TopicEvent.MessageRead("m-1", "u1")).test();
    scheduler.triggerActions();

    // seq 1 was u1's own join diff.
    published.assertValue(e -> e.seq() == 2);
  }

  @Test
  void statusUpdatesBroadcastAPresenceDiff() {
    FakeMember u1 = new FakeMember("u1", "d1");
    FakeMember u2 = new FakeMember("u2", "d2");
    join(u1);
    join(u2);
    u1.events.clear();

    owner.updateStatus("u2", "d2", PresenceStatus.BUSY).test();
    scheduler.triggerActions();

    assertEquals(List.of("presence_diff"), u1.names());
  }

  @Test
  void classifiedFailuresOnlyFailTheCall() {
    TestObserver<Object> call =
        owner
            .submit(
                "probe",
                () -> {
                  throw RealtimeException.invalid("nope");
                })
            .test();
    scheduler.triggerActions();

    call.assertError(RealtimeException.class);
    assertFalse(owner.isStopped());
    assertTrue(failedTails.isEmpty());
  }

  @Test
  void unexpectedFailureStopsTheOwnerAndReportsTheTail() {
    FakeMember u1 = new FakeMember("u1", "d1");
    join(u1);
    owner.publish(new TopicEvent.MessageRead("m-1", "u1")).test();
    scheduler.triggerActions();

    TestObserver<Object> call =
        owner
            .submit(
                "probe",
                () -> {
                  throw new IllegalStateException("boom");
                })
            .test();
    scheduler.triggerActions();

    call.assertError(IllegalStateException.class);
    assertTrue(owner.isStopped());
    assertEquals(List.of(2L), failedTails);

    TestObserver<SequencedEvent> after =
        owner.publish(new TopicEvent.MessageRead("m-2", "u1")).test();
    scheduler.triggerActions();
    after.assertError(IllegalStateException.class);
  }

  @Test
  void shutdownDropsTypingTimersSilently() {
    FakeMember u1 = new FakeMember("u1", "d1");
    FakeMember u2 = new FakeMember("u2", "d2");
    join(u1);
    join(u2);
    owner.typingStart("u2").test();
    scheduler.triggerActions();
    u1.events.clear();

    owner.shutdown().test();
    scheduler.advanceTimeBy(1, TimeUnit.MINUTES);

    assertTrue(owner.isStopped());
    assertTrue(u1.events.isEmpty());
  }

  private JoinTicket join(FakeMember member) {
    TestObserver<JoinTicket> t = owner.join(member, meta(member.deviceId)).test();
    scheduler.triggerActions();
    t.assertComplete();
    return t.values().get(0);
  }

  private static PresenceMeta meta(String device) {
    return new PresenceMeta(device, PresenceStatus.ONLINE, Instant.EPOCH);
  }
}
