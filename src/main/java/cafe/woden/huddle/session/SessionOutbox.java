package cafe.woden.huddle.session;

import io.reactivex.rxjava3.core.Scheduler;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded outbound queue of one session.
 *
 * <p>Pushes are delivered to the {@link Connection} in offer order on a dedicated drain worker, so
 * a slow client never blocks the topic owner. At most {@code capacity} pushes may wait; {@link
 * #offer} returns false beyond that.
 *
 * <p>While {@link #hold() held}, offered pushes are parked. {@link #release(ServerPush)} puts a
 * head push in front of them, which is how the {@code joined} snapshot always reaches the client
 * before events of the same join.
 */
final class SessionOutbox {
  private static final Logger log = LoggerFactory.getLogger(SessionOutbox.class);

  private final String label;
  private final Connection connection;
  private final Scheduler.Worker drainWorker;
  private final int capacity;
  private final Runnable onDeliveryFailure;

  // Guarded by this.
  private final Queue<ServerPush> ready = new ArrayDeque<>();
  private final List<ServerPush> parked = new ArrayList<>();
  private boolean held;
  private boolean closing;
  private boolean closed;

  private final AtomicBoolean drainScheduled = new AtomicBoolean();

  SessionOutbox(
      String label,
      Connection connection,
      Scheduler.Worker drainWorker,
      int capacity,
      Runnable onDeliveryFailure) {
    this.label = Objects.toString(label, "session");
    this.connection = Objects.requireNonNull(connection, "connection");
    this.drainWorker = Objects.requireNonNull(drainWorker, "drainWorker");
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
    this.capacity = capacity;
    this.onDeliveryFailure = Objects.requireNonNull(onDeliveryFailure, "onDeliveryFailure");
  }

  /**
   * Queues {@code push}. Returns false if the queue is full. Pushes offered after {@link #close}
   * are dropped and reported as accepted.
   */
  boolean offer(ServerPush push) {
    Objects.requireNonNull(push, "push");
    synchronized (this) {
      if (closing || closed) return true;
      if (ready.size() + parked.size() >= capacity) return false;
      if (held) {
        parked.add(push);
        return true;
      }
      ready.add(push);
    }
    scheduleDrain();
    return true;
  }

  synchronized void hold() {
    held = true;
  }

  /** Delivers {@code head} first, then everything parked while held. */
  void release(ServerPush head) {
    synchronized (this) {
      if (closing || closed) return;
      held = false;
      if (head != null) ready.add(head);
      ready.addAll(parked);
      parked.clear();
    }
    scheduleDrain();
  }

  /** Flushes what is queued (parked pushes included), then {@code last}, then stops. */
  void closeAfterFlush(ServerPush last) {
    synchronized (this) {
      if (closing || closed) return;
      held = false;
      ready.addAll(parked);
      parked.clear();
      if (last != null) ready.add(last);
      closing = true;
    }
    scheduleDrain();
  }

  /** Drops everything queued, delivers only {@code last}, then stops. */
  void abort(ServerPush last) {
    int dropped;
    synchronized (this) {
      if (closing || closed) return;
      dropped = ready.size() + parked.size();
      ready.clear();
      parked.clear();
      held = false;
      if (last != null) ready.add(last);
      closing = true;
    }
    log.debug("[{}] outbox aborted, {} push(es) dropped", label, dropped);
    scheduleDrain();
  }

  synchronized int size() {
    return ready.size() + parked.size();
  }

  synchronized boolean isClosed() {
    return closed;
  }

  private void scheduleDrain() {
    if (drainScheduled.compareAndSet(false, true)) {
      var unused = drainWorker.schedule(this::drain);
    }
  }

  private void drain() {
    drainScheduled.set(false);
    for (; ; ) {
      ServerPush next;
      synchronized (this) {
        if (closed) return;
        next = ready.poll();
        if (next == null) {
          if (closing) {
            closed = true;
            drainWorker.dispose();
          }
          return;
        }
      }
      try {
        connection.push(next);
      } catch (RuntimeException e) {
        log.warn("[{}] delivery failed, dropping outbox: {}", label, e.toString());
        synchronized (this) {
          ready.clear();
          parked.clear();
          closed = true;
        }
        drainWorker.dispose();
        onDeliveryFailure.run();
        return;
      }
    }
  }
}
