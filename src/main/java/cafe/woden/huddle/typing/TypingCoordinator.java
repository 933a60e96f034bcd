package cafe.woden.huddle.typing;

import cafe.woden.huddle.broadcast.TopicBroadcaster;
import cafe.woden.huddle.model.TopicEvent;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debounces typing activity for one topic.
 *
 * <p>At most one typing state exists per identity. The first {@link #start} publishes {@code
 * TypingStarted}; repeated starts only push the expiry out. The state ends with exactly one {@code
 * TypingStopped}, either from {@link #stop} or from the inactivity timer.
 *
 * <p>Expiry timers are delayed tasks on {@code timers}, which must be the owning topic's inbox
 * worker: a timer firing is then just another serialized inbox task.
 */
public final class TypingCoordinator {
  private static final Logger log = LoggerFactory.getLogger(TypingCoordinator.class);

  private final TopicBroadcaster broadcaster;
  private final Scheduler.Worker timers;
  private final long timeoutMs;
  private final Map<String, TypingState> stateByIdentity = new HashMap<>();

  private static final class TypingState {
    final String identity;
    long expiresAtMs;
    Disposable timer = Disposable.disposed();

    TypingState(String identity) {
      this.identity = identity;
    }
  }

  public TypingCoordinator(
      TopicBroadcaster broadcaster, Scheduler.Worker timers, Duration timeout) {
    this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
    this.timers = Objects.requireNonNull(timers, "timers");
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("typing timeout must be positive: " + timeout);
    }
    this.timeoutMs = timeout.toMillis();
  }

  /** Returns true if this call published {@code TypingStarted}, false if it only refreshed. */
  public boolean start(String identity) {
    String who = norm(identity);
    if (who.isEmpty()) return false;
    long now = now();

    TypingState state = stateByIdentity.get(who);
    if (state != null && now < state.expiresAtMs) {
      arm(state, now);
      return false;
    }
    if (state != null) {
      // Expired but the timer has not run yet.
      end(state);
    }

    TypingState fresh = new TypingState(who);
    stateByIdentity.put(who, fresh);
    broadcaster.publish(new TopicEvent.TypingStarted(who));
    arm(fresh, now);
    return true;
  }

  /** Returns true if a typing state existed and {@code TypingStopped} was published. */
  public boolean stop(String identity) {
    TypingState state = stateByIdentity.get(norm(identity));
    if (state == null) return false;
    end(state);
    return true;
  }

  public boolean isTyping(String identity) {
    return stateByIdentity.containsKey(norm(identity));
  }

  /** Disposes every timer without publishing; used when the topic owner goes away. */
  public void cancelAll() {
    for (TypingState state : stateByIdentity.values()) {
      state.timer.dispose();
    }
    stateByIdentity.clear();
  }

  private void arm(TypingState state, long now) {
    state.timer.dispose();
    state.expiresAtMs = now + timeoutMs;
    state.timer = timers.schedule(() -> expire(state), timeoutMs, TimeUnit.MILLISECONDS);
  }

  // Each refresh disposes the previous timer, so a timer that fires is always current.
  private void expire(TypingState state) {
    if (stateByIdentity.get(state.identity) != state) return;
    log.debug("[{}] typing expired for {}", broadcaster.topic(), state.identity);
    end(state);
  }

  private void end(TypingState state) {
    state.timer.dispose();
    stateByIdentity.remove(state.identity, state);
    broadcaster.publish(new TopicEvent.TypingStopped(state.identity));
  }

  private long now() {
    return timers.now(TimeUnit.MILLISECONDS);
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }
}
