package cafe.woden.huddle.typing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.huddle.broadcast.TopicBroadcaster;
import cafe.woden.huddle.broadcast.TopicSubscriber;
import cafe.woden.huddle.model.SequencedEvent;
import cafe.woden.huddle.model.TopicRef;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TypingCoordinatorTest {

  private TestScheduler scheduler;
  private TopicBroadcaster broadcaster;
  private TypingCoordinator typing;
  private final List<String> events = new ArrayList<>();

  @BeforeEach
  void setUp() {
    scheduler = new TestScheduler();
    broadcaster = new TopicBroadcaster(TopicRef.channel("general"), 0);
    broadcaster.subscribe(
        new TopicSubscriber() {
          @Override
          public String identity() {
            return "observer";
          }

          @Override
          public boolean offer(SequencedEvent event) {
            return events.add(event.event().eventName() + ":" + event.typingIdentity());
          }

          @Override
          public void onOverflow() {}
        },
        1);
    typing = new TypingCoordinator(broadcaster, scheduler.createWorker(), Duration.ofSeconds(5));
  }

  @Test
  void repeatedStartsPublishOnce() {
    assertTrue(typing.start("u1"));
    scheduler.advanceTimeBy(1, TimeUnit.SECONDS);
    assertFalse(typing.start("u1"));
    assertFalse(typing.start("u1"));

    assertEquals(List.of("typing_started:u1"), events);
  }

  @Test
  void inactivityExpiresOnceAfterTheTimeout() {
    typing.start("u1");

    scheduler.advanceTimeBy(4_999, TimeUnit.MILLISECONDS);
    assertEquals(List.of("typing_started:u1"), events);

    scheduler.advanceTimeBy(1, TimeUnit.MILLISECONDS);
    assertEquals(List.of("typing_started:u1", "typing_stopped:u1"), events);
    assertFalse(typing.isTyping("u1"));

    scheduler.advanceTimeBy(1, TimeUnit.MINUTES);
    assertEquals(2, events.size());
  }

  @Test
  void refreshingPushesTheExpiryOut() {
    typing.start("u1");
    scheduler.advanceTimeBy(3, TimeUnit.SECONDS);
    typing.start("u1");

    scheduler.advanceTimeBy(4, TimeUnit.SECONDS);
    assertTrue(typing.isTyping("u1"));

    scheduler.advanceTimeBy(1, TimeUnit.SECONDS);
    assertFalse(typing.isTyping("u1"));
    assertEquals(List.of("typing_started:u1", "typing_stopped:u1"), events);
  }

  @Test
  void explicitStopCancelsTheTimer() {
    typing.start("u1");
    assertTrue(typing.stop("u1"));

    scheduler.advanceTimeBy(10, TimeUnit.SECONDS);

    assertEquals(List.of("typing_started:u1", "typing_stopped:u1"), events);
  }

  @Test
  void stopWithoutTypingIsANoOp() {
    assertFalse(typing.stop("u1"));
    assertTrue(events.isEmpty());
  }

  @Test
  void startingAgainAfterExpiryPublishesAFreshStart() {
    typing.start("u1");
    scheduler.advanceTimeBy(5, TimeUnit.SECONDS);
    assertTrue(typing.start("u1"));

    assertEquals(
        List.of("typing_started:u1", "typing_stopped:u1", "typing_started:u1"), events);
  }

  @Test
  void identitiesAreIndependent() {
    typing.start("u1");
    scheduler.advanceTimeBy(2, TimeUnit.SECONDS);
    typing.start("u2");
    typing.stop("u1");

    scheduler.advanceTimeBy(5, TimeUnit.SECONDS);

    assertEquals(
        List.of("typing_started:u1", "typing_started:u2", "typing_stopped:u1", "typing_stopped:u2"),
        events);
  }

  @Test
  void cancelAllDropsTimersSilently() {
    typing.start("u1");
    typing.start("u2");
    events.clear();

    typing.cancelAll();
    scheduler.advanceTimeBy(1, TimeUnit.MINUTES);

    assertTrue(events.isEmpty());
    assertFalse(typing.isTyping("u1"));
  }

  @Test
  void firedTimerEndsTypingEvenWhenTheWorkerClockLags() {
    TypingCoordinator lagging =
        new TypingCoordinator(
            broadcaster, new LaggingWorker(scheduler.createWorker(), 1), Duration.ofSeconds(5));

    lagging.start("u1");
    scheduler.advanceTimeBy(1, TimeUnit.HOURS);

    assertEquals(List.of("typing_started:u1", "typing_stopped:u1"), events);
    assertFalse(lagging.isTyping("u1"));
  }

  /** Runs delays on the wrapped worker but reports a wall clock {@code lagMs} behind it. */
  private static final class LaggingWorker extends Scheduler.Worker {
    private final Scheduler.Worker delegate;
    private final long lagMs;

    LaggingWorker(Scheduler.Worker delegate, long lagMs) {
      this.delegate = delegate;
      this.lagMs = lagMs;
    }

    @Override
    public Disposable schedule(Runnable run, long delay, TimeUnit unit) {
      return delegate.schedule(run, delay, unit);
    }

    @Override
    public long now(TimeUnit unit) {
      return unit.convert(delegate.now(TimeUnit.MILLISECONDS) - lagMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void dispose() {
      delegate.dispose();
    }

    @Override
    public boolean isDisposed() {
      return delegate.isDisposed();
    }
  }
}
