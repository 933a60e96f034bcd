package cafe.woden.huddle.session;

import cafe.woden.huddle.auth.AuthorizationDecision;
import cafe.woden.huddle.model.ChatMessage;
import cafe.woden.huddle.model.ErrorKind;
import cafe.woden.huddle.model.PresenceMeta;
import cafe.woden.huddle.model.PresenceStatus;
import cafe.woden.huddle.model.RealtimeException;
import cafe.woden.huddle.model.SequencedEvent;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.model.TopicRef;
import cafe.woden.huddle.topic.JoinTicket;
import cafe.woden.huddle.topic.TopicMember;
import cafe.woden.huddle.topic.TopicOwner;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One client's membership in one topic.
 *
 * <p>Lifecycle: {@code CONNECTING -> JOINING -> JOINED -> TERMINATED}. Every command and every
 * asynchronous completion runs on the session's own worker, so the session's fields need no
 * locking. Termination happens exactly once whatever the cause and always releases what the
 * session holds on its topic: typing state it started, its presence meta and its subscription.
 *
 * <p>Store results are not echoed to the sender directly; the sender sees its own change through
 * the topic broadcast like everybody else. Failures go to the sender only, tagged with the frame's
 * {@code client_ref}.
 */
public final class Session implements TopicMember {
  private static final Logger log = LoggerFactory.getLogger(Session.class);

  public static final String SESSION_RESTARTED = "session_restarted";

  private final SessionFactory deps;
  private final String id;
  private final ConnectionContext ctx;
  private final SessionListener listener;
  private final Scheduler.Worker worker;
  private final SessionOutbox outbox;
  private final AtomicBoolean terminated = new AtomicBoolean();

  private volatile SessionState state = SessionState.CONNECTING;
  private volatile TopicRef topic;
  private volatile TopicOwner owner;

  // Worker-confined.
  private String requestedTopic = "";
  private String joinClientRef;
  private PresenceMeta meta;
  private boolean typingOwned;
  private long joinGeneration;

  Session(
      SessionFactory deps,
      String id,
      ConnectionContext ctx,
      Connection connection,
      SessionListener listener) {
    this.deps = Objects.requireNonNull(deps, "deps");
    this.id = Objects.requireNonNull(id, "id");
    this.ctx = Objects.requireNonNull(ctx, "ctx");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.worker = deps.sessionScheduler.createWorker();
    this.outbox =
        new SessionOutbox(
            id,
            connection,
            deps.sessionScheduler.createWorker(),
            deps.settings.outboundQueueCapacity(),
            () -> close(TerminationReason.CONNECTION_CLOSED));
  }

  public String id() {
    return id;
  }

  public SessionState state() {
    return state;
  }

  public Optional<TopicRef> topic() {
    return Optional.ofNullable(topic);
  }

  @Override
  public String identity() {
    return ctx.identity();
  }

  @Override
  public String deviceId() {
    return ctx.deviceId();
  }

  /** Queues a client frame for this session. */
  public void submit(ClientFrame frame) {
    Objects.requireNonNull(frame, "frame");
    var unused = worker.schedule(guarded(frame.op(), frame.clientRef(), () -> handle(frame)));
  }

  /** Ends the session from outside, e.g. when the connection goes away. */
  public void close(TerminationReason reason) {
    var unused =
        worker.schedule(
            guarded("close", null, () -> terminate(Objects.requireNonNull(reason), null)));
  }

  @Override
  public boolean offer(SequencedEvent event) {
    if (terminated.get()) return true;
    return outbox.offer(new ServerPush.Event(event));
  }

  @Override
  public void onOverflow() {
    var unused =
        worker.schedule(
            guarded(
                "overflow",
                null,
                () ->
                    terminate(
                        TerminationReason.BACKPRESSURE,
                        new ServerPush.Error(
                            topicLabel(), "", ErrorKind.BACKPRESSURE.defaultReason(), null))));
  }

  @Override
  public void onOwnerRestarted(TopicOwner replacement) {
    var unused = worker.schedule(guarded("rejoin", null, () -> rejoin(replacement)));
  }

  private void handle(ClientFrame frame) {
    if (state == SessionState.TERMINATED) return;
    ClientCommand cmd = frame.command();

    if (cmd instanceof ClientCommand.Join) {
      join(frame);
      return;
    }
    if (state != SessionState.JOINED) {
      log.debug("[{}] {} rejected in state {}", topicLabel(frame), frame.op(), state);
      pushError(frame, ErrorKind.INVALID.defaultReason());
      return;
    }

    if (cmd instanceof ClientCommand.Leave) {
      terminate(TerminationReason.LEFT, null);
    } else if (cmd instanceof ClientCommand.SendMessage send) {
      String threadId = Objects.toString(send.threadId(), "").trim();
      if (threadId.isEmpty()) {
        relay(
            frame, deps.store.createMessage(topic, identity(), send.content(), send.attachments()));
      } else {
        relay(
            frame,
            deps.store.createThreadReply(
                topic, threadId, identity(), send.content(), send.attachments()));
      }
    } else if (cmd instanceof ClientCommand.EditMessage edit) {
      relay(frame, deps.store.editMessage(topic, edit.messageId(), identity(), edit.content()));
    } else if (cmd instanceof ClientCommand.DeleteMessage delete) {
      relay(frame, deps.store.deleteMessage(topic, delete.messageId(), identity()));
    } else if (cmd instanceof ClientCommand.AddReaction add) {
      relay(frame, deps.store.addReaction(topic, add.messageId(), identity(), add.emoji()));
    } else if (cmd instanceof ClientCommand.RemoveReaction remove) {
      relay(
          frame, deps.store.removeReaction(topic, remove.messageId(), identity(), remove.emoji()));
    } else if (cmd instanceof ClientCommand.StartThread start) {
      relay(
          frame,
          deps.store.createThreadReply(
              topic, start.messageId(), identity(), start.content(), List.of()));
    } else if (cmd instanceof ClientCommand.MarkRead read) {
      relay(frame, deps.store.markRead(topic, read.messageId(), identity()));
    } else if (cmd instanceof ClientCommand.LoadOlderMessages older) {
      loadOlder(frame, older.beforeId());
    } else if (cmd instanceof ClientCommand.UpdateStatus update) {
      updateStatus(frame, update.status());
    } else if (cmd instanceof ClientCommand.TypingStart) {
      typingOwned = true;
      var unused =
          owner.typingStart(identity()).subscribe(started -> {}, err -> ownerFailed(frame, err));
    } else if (cmd instanceof ClientCommand.TypingStop) {
      typingOwned = false;
      var unused =
          owner.typingStop(identity()).subscribe(stopped -> {}, err -> ownerFailed(frame, err));
    }
  }

  private void join(ClientFrame frame) {
    if (state != SessionState.CONNECTING) {
      pushError(frame, ErrorKind.INVALID.defaultReason());
      return;
    }
    state = SessionState.JOINING;
    requestedTopic = frame.topic();
    joinClientRef = frame.clientRef();
    outbox.hold();

    AuthorizationDecision decision;
    try {
      decision = deps.gate.authorize(identity(), requestedTopic);
    } catch (RealtimeException e) {
      log.warn("[{}] join by {} failed: {}", requestedTopic, identity(), e.getMessage());
      denyJoin(e.reason());
      return;
    }
    if (decision instanceof AuthorizationDecision.Deny deny) {
      log.info("[{}] join by {} denied: {}", requestedTopic, identity(), deny.reason());
      denyJoin(deny.reason());
      return;
    }

    topic =
        TopicRef.parse(requestedTopic)
            .orElseThrow(() -> new IllegalStateException("authorized an unparseable topic"));
    meta = new PresenceMeta(deviceId(), PresenceStatus.ONLINE, deps.clock.instant());
    attach(deps.registry.acquire(topic, this));
  }

  private void denyJoin(String reason) {
    terminate(
        TerminationReason.JOIN_DENIED,
        new ServerPush.Error(requestedTopic, "join", reason, joinClientRef));
  }

  /** Joins {@code target} and pushes a fresh snapshot once both presence and backlog are in. */
  private void attach(TopicOwner target) {
    owner = target;
    typingOwned = false;
    long generation = ++joinGeneration;
    TopicRef t = topic;

    var unused =
        target
            .join(this, meta)
            .flatMap(ticket -> recentMessages(t).map(recent -> toJoined(t, ticket, recent)))
            .subscribe(
                joined ->
                    worker.schedule(
                        guarded("join", joinClientRef, () -> completeJoin(generation, joined))),
                err ->
                    worker.schedule(
                        guarded("join", joinClientRef, () -> joinFailed(generation, err))));
  }

  private Single<List<ChatMessage>> recentMessages(TopicRef t) {
    return bounded(deps.store.listRecent(t, deps.settings.recentMessageLimit()))
        .onErrorReturn(
            err -> {
              log.warn("[{}] backlog unavailable for {}: {}", t, identity(), err.toString());
              return List.of();
            });
  }

  private static ServerPush.Joined toJoined(
      TopicRef t, JoinTicket ticket, List<ChatMessage> recent) {
    return new ServerPush.Joined(t.value(), ticket.presence(), recent);
  }

  private void completeJoin(long generation, ServerPush.Joined joined) {
    if (terminated.get() || generation != joinGeneration) return;
    boolean first = state == SessionState.JOINING;
    state = SessionState.JOINED;
    outbox.release(joined);
    if (first) {
      log.info("[{}] {} joined (session {}, device {})", topic, identity(), id, deviceId());
    } else {
      log.info("[{}] {} re-joined after owner restart (session {})", topic, identity(), id);
    }
  }

  private void joinFailed(long generation, Throwable err) {
    if (terminated.get() || generation != joinGeneration) return;
    if (err instanceof RealtimeException re) {
      denyJoin(re.reason());
      return;
    }
    TopicOwner current = owner;
    if (current != null && current.isStopped()) {
      // The registry hands out a replacement and calls onOwnerRestarted.
      log.debug("[{}] join of session {} interrupted by owner restart", topic, id);
      return;
    }
    throw new IllegalStateException("join failed on " + topic, err);
  }

  private void rejoin(TopicOwner replacement) {
    if (terminated.get() || topic == null || meta == null) return;
    log.info("[{}] owner restarted, session {} re-registering", topic, id);
    outbox.hold();
    attach(replacement);
  }

  private <E extends TopicEvent> void relay(ClientFrame frame, Single<E> storeCall) {
    var unused =
        bounded(storeCall)
            .subscribe(event -> broadcast(frame, event), err -> reportFailure(frame, err));
  }

  private <T> Single<T> bounded(Single<T> storeCall) {
    return storeCall.timeout(
        deps.settings.storeTimeout().toMillis(), TimeUnit.MILLISECONDS, deps.timeoutScheduler);
  }

  private void broadcast(ClientFrame frame, TopicEvent event) {
    TopicOwner current = owner;
    var unused =
        current
            .publish(event)
            .subscribe(
                sequenced ->
                    log.trace("[{}] {} published as seq {}", topic, frame.op(), sequenced.seq()),
                err ->
                    log.warn(
                        "[{}] {} by {} stored but not broadcast: {}",
                        topic,
                        event.eventName(),
                        identity(),
                        err.toString()));
  }

  private void loadOlder(ClientFrame frame, String beforeId) {
    TopicRef t = topic;
    var unused =
        bounded(deps.store.listBefore(t, beforeId, deps.settings.olderMessageLimit()))
            .subscribe(
                messages ->
                    worker.schedule(
                        guarded(
                            frame.op(),
                            frame.clientRef(),
                            () ->
                                push(
                                    new ServerPush.OlderMessagesLoaded(
                                        t.value(), messages, frame.clientRef())))),
                err -> reportFailure(frame, err));
  }

  private void updateStatus(ClientFrame frame, String rawStatus) {
    Optional<PresenceStatus> status = PresenceStatus.fromWire(rawStatus);
    if (status.isEmpty()) {
      pushError(frame, ErrorKind.INVALID.defaultReason());
      return;
    }
    meta = meta.withStatus(status.get());
    var unused =
        owner
            .updateStatus(identity(), deviceId(), status.get())
            .subscribe(diff -> {}, err -> ownerFailed(frame, err));
  }

  private void reportFailure(ClientFrame frame, Throwable err) {
    RealtimeException classified = RealtimeException.classify(err);
    log.debug(
        "[{}] {} by {} failed: {} ({})",
        topic,
        frame.op(),
        identity(),
        classified.reason(),
        classified.getMessage());
    var unused =
        worker.schedule(
            guarded(frame.op(), frame.clientRef(), () -> pushError(frame, classified.reason())));
  }

  private void ownerFailed(ClientFrame frame, Throwable err) {
    TopicOwner current = owner;
    if (current != null && current.isStopped()) {
      log.debug("[{}] {} dropped during owner restart", topic, frame.op());
      return;
    }
    reportFailure(frame, err);
  }

  private void pushError(ClientFrame frame, String reason) {
    if (terminated.get()) return;
    push(new ServerPush.Error(topicLabel(frame), frame.op(), reason, frame.clientRef()));
  }

  private void push(ServerPush push) {
    if (terminated.get()) return;
    if (!outbox.offer(push)) {
      terminate(
          TerminationReason.BACKPRESSURE,
          new ServerPush.Error(topicLabel(), "", ErrorKind.BACKPRESSURE.defaultReason(), null));
    }
  }

  /** Runs on the worker. Releases the topic and closes the outbox; only the first call counts. */
  private void terminate(TerminationReason reason, ServerPush last) {
    if (!terminated.compareAndSet(false, true)) return;
    state = SessionState.TERMINATED;
    joinGeneration++;

    TopicOwner current = owner;
    TopicRef t = topic;
    if (current != null && t != null) {
      var unused =
          current
              .leave(this, typingOwned)
              .subscribe(
                  () -> {},
                  err -> log.debug("[{}] leave of session {} skipped: {}", t, id, err.toString()));
      deps.registry.release(t, this);
    }

    if (reason == TerminationReason.BACKPRESSURE) {
      outbox.abort(last);
    } else {
      outbox.closeAfterFlush(last);
    }

    if (reason == TerminationReason.CRASHED || reason == TerminationReason.BACKPRESSURE) {
      log.warn(
          "[{}] session {} of {} terminated: {}", topicLabel(), id, identity(), reason.wireName());
    } else {
      log.info(
          "[{}] session {} of {} terminated: {}", topicLabel(), id, identity(), reason.wireName());
    }

    try {
      listener.onTerminated(this, reason);
    } finally {
      worker.dispose();
    }
  }

  private Runnable guarded(String op, String clientRef, Runnable action) {
    return () -> {
      try {
        action.run();
      } catch (RuntimeException e) {
        log.error("[{}] session {} crashed during {}", topicLabel(), id, op, e);
        try {
          terminate(
              TerminationReason.CRASHED,
              new ServerPush.Error(topicLabel(), op, SESSION_RESTARTED, clientRef));
        } catch (RuntimeException cleanup) {
          log.error("[{}] cleanup of crashed session {} failed", topicLabel(), id, cleanup);
        }
      }
    };
  }

  private String topicLabel() {
    TopicRef t = topic;
    return t != null ? t.value() : requestedTopic;
  }

  private String topicLabel(ClientFrame frame) {
    TopicRef t = topic;
    return t != null ? t.value() : frame.topic();
  }

  @Override
  public String toString() {
    return "Session[" + id + " " + identity() + "@" + topicLabel() + " " + state + "]";
  }
}
