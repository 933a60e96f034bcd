package cafe.woden.huddle.topic;

import cafe.woden.huddle.broadcast.Subscription;
import cafe.woden.huddle.broadcast.TopicBroadcaster;
import cafe.woden.huddle.model.PresenceDiff;
import cafe.woden.huddle.model.PresenceMeta;
import cafe.woden.huddle.model.PresenceStatus;
import cafe.woden.huddle.model.RealtimeException;
import cafe.woden.huddle.model.SequencedEvent;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.model.TopicRef;
import cafe.woden.huddle.presence.PresenceTracker;
import cafe.woden.huddle.typing.TypingCoordinator;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serialized owner of one topic's state.
 *
 * <p>Holds the topic's broadcaster, presence tracker and typing coordinator and touches them only
 * from its inbox worker, one task at a time. Callers get a {@link Single} or {@link Completable}
 * that completes once their task ran.
 *
 * <p>A {@link RealtimeException} thrown by a task fails only that call. Any other runtime failure
 * is a fault of the owner itself: it stops, and the {@link FailureListener} (the registry) starts
 * a replacement.
 */
public final class TopicOwner {
  private static final Logger log = LoggerFactory.getLogger(TopicOwner.class);

  /** Told when an owner stopped because one of its tasks failed. */
  interface FailureListener {
    void onOwnerFailed(TopicOwner owner, long tailSeq, Throwable cause);
  }

  private record Membership(String identity, String deviceId, Subscription subscription) {}

  private record DeviceKey(String identity, String deviceId) {}

  private final TopicRef topic;
  private final Scheduler.Worker inbox;
  private final TopicBroadcaster broadcaster;
  private final PresenceTracker presence;
  private final TypingCoordinator typing;
  private final FailureListener failureListener;
  private final Map<TopicMember, Membership> members = new LinkedHashMap<>();
  // The member whose join last tracked each device's meta.
  private final Map<DeviceKey, TopicMember> metaHolders = new HashMap<>();

  // Written on the inbox only; read from anywhere.
  private volatile boolean stopped;

  TopicOwner(
      TopicRef topic,
      long initialSeq,
      Scheduler scheduler,
      Duration typingTimeout,
      FailureListener failureListener) {
    this.topic = Objects.requireNonNull(topic, "topic");
    this.inbox = Objects.requireNonNull(scheduler, "scheduler").createWorker();
    this.broadcaster = new TopicBroadcaster(topic, initialSeq);
    this.presence = new PresenceTracker(broadcaster);
    this.typing = new TypingCoordinator(broadcaster, inbox, typingTimeout);
    this.failureListener = Objects.requireNonNull(failureListener, "failureListener");
  }

  public TopicRef topic() {
    return topic;
  }

  public boolean isStopped() {
    return stopped;
  }

  /**
   * Tracks the member's meta and subscribes it from the current tail in one inbox turn. Joining
   * again with the same member replaces its previous registration.
   */
  public Single<JoinTicket> join(TopicMember member, PresenceMeta meta) {
    Objects.requireNonNull(member, "member");
    Objects.requireNonNull(meta, "meta");
    return submit(
        "join",
        () -> {
          Membership previous = members.remove(member);
          if (previous != null) broadcaster.unsubscribe(previous.subscription());

          presence.track(member.identity(), meta);
          metaHolders.put(new DeviceKey(member.identity(), meta.deviceId()), member);
          Subscription sub = broadcaster.subscribe(member, broadcaster.tailSeq() + 1);
          members.put(member, new Membership(member.identity(), meta.deviceId(), sub));
          log.debug(
              "[{}] {} joined from seq {} ({} subscriber(s))",
              topic,
              member.identity(),
              sub.fromSeq(),
              broadcaster.subscriberCount());
          return new JoinTicket(sub, presence.snapshot());
        });
  }

  /**
   * Unsubscribes the member, stops its identity's typing state if it owned one and untracks its
   * meta. Unknown members are ignored. A meta that a later join of the same device replaced stays
   * tracked.
   */
  public Completable leave(TopicMember member, boolean stopTyping) {
    return submit(
            "leave",
            () -> {
              Membership m = members.remove(member);
              if (m == null) return false;
              broadcaster.unsubscribe(m.subscription());
              if (stopTyping) typing.stop(m.identity());
              if (metaHolders.remove(new DeviceKey(m.identity(), m.deviceId()), member)) {
                presence.untrack(m.identity(), m.deviceId());
              }
              log.debug(
                  "[{}] {} left ({} subscriber(s))",
                  topic,
                  m.identity(),
                  broadcaster.subscriberCount());
              return true;
            })
        .ignoreElement();
  }

  public Single<SequencedEvent> publish(TopicEvent event) {
    Objects.requireNonNull(event, "event");
    return submit("publish " + event.eventName(), () -> broadcaster.publish(event));
  }

  public Single<Boolean> typingStart(String identity) {
    return submit("typing_start", () -> typing.start(identity));
  }

  public Single<Boolean> typingStop(String identity) {
    return submit("typing_stop", () -> typing.stop(identity));
  }

  public Single<PresenceDiff> updateStatus(
      String identity, String deviceId, PresenceStatus status) {
    return submit("update_status", () -> presence.updateStatus(identity, deviceId, status));
  }

  public Single<Map<String, List<PresenceMeta>>> presenceSnapshot() {
    return submit("presence_snapshot", presence::snapshot);
  }

  /** Stops the owner after already queued tasks. Typing timers are dropped without events. */
  Completable shutdown() {
    return Completable.create(
        emitter -> {
          var unused =
              inbox.schedule(
                  () -> {
                    stop();
                    emitter.onComplete();
                  });
          if (inbox.isDisposed()) emitter.onComplete();
        });
  }

  /**
   * Runs {@code action} on the inbox. Exposed to the package so tests can drive the failure path.
   */
  <T> Single<T> submit(String op, Callable<T> action) {
    return Single.create(
        emitter -> {
          if (stopped) {
            emitter.onError(stoppedError(op));
            return;
          }
          var unused =
              inbox.schedule(
                  () -> {
                    if (stopped) {
                      emitter.onError(stoppedError(op));
                      return;
                    }
                    T result;
                    try {
                      result = action.call();
                    } catch (RealtimeException e) {
                      emitter.onError(e);
                      return;
                    } catch (Exception e) {
                      fail(op, e);
                      emitter.onError(e);
                      return;
                    }
                    emitter.onSuccess(result);
                  });
          if (inbox.isDisposed()) emitter.tryOnError(stoppedError(op));
        });
  }

  private void fail(String op, Exception cause) {
    log.error("[{}] topic owner failed during {}; restarting", topic, op, cause);
    long tail = broadcaster.tailSeq();
    stop();
    failureListener.onOwnerFailed(this, tail, cause);
  }

  private void stop() {
    if (stopped) return;
    stopped = true;
    typing.cancelAll();
    members.clear();
    metaHolders.clear();
    inbox.dispose();
  }

  private IllegalStateException stoppedError(String op) {
    return new IllegalStateException("topic owner for " + topic + " is stopped (" + op + ")");
  }

  @Override
  public String toString() {
    return "TopicOwner[" + topic + "]";
  }
}
