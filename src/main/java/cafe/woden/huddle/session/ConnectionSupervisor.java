package cafe.woden.huddle.session;

import cafe.woden.huddle.model.ErrorKind;
import cafe.woden.huddle.model.TopicRef;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the sessions of one client connection, at most one per topic.
 *
 * <p>A {@code join} for a topic without a live session starts one; every other frame goes to the
 * session of its topic, or to the only session when the frame names none. A session that crashed
 * is replaced by a fresh one in {@link SessionState#CONNECTING}, which takes the client's next
 * {@code join} for that topic.
 */
public final class ConnectionSupervisor implements SessionListener {
  private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

  private final ConnectionContext ctx;
  private final SessionFactory factory;
  private final Connection connection;

  // Guarded by this.
  private final Map<String, Session> sessionsByTopic = new LinkedHashMap<>();
  private boolean closed;

  public ConnectionSupervisor(
      ConnectionContext ctx, SessionFactory factory, Connection connection) {
    this.ctx = Objects.requireNonNull(ctx, "ctx");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  public ConnectionContext context() {
    return ctx;
  }

  public void receive(ClientFrame frame) {
    Objects.requireNonNull(frame, "frame");
    Session target;
    ServerPush.Error rejection = null;
    synchronized (this) {
      if (closed) return;
      String key = topicKey(frame.topic());
      if (frame.command() instanceof ClientCommand.Join) {
        target = sessionsByTopic.get(key);
        if (target == null || target.state() == SessionState.TERMINATED) {
          target = factory.create(ctx, connection, this);
          sessionsByTopic.put(key, target);
        }
      } else {
        target = key.isEmpty() ? onlySession() : sessionsByTopic.get(key);
        if (target == null) {
          rejection =
              new ServerPush.Error(
                  key, frame.op(), ErrorKind.INVALID.defaultReason(), frame.clientRef());
        }
      }
    }

    if (rejection != null) {
      log.debug("[{}] {} has no session for {}", ctx.connectionId(), frame.op(), frame.topic());
      reject(rejection);
      return;
    }
    target.submit(frame);
  }

  /** Direct error push for frames that reach no session. */
  public void reject(ServerPush.Error error) {
    try {
      connection.push(error);
    } catch (RuntimeException e) {
      log.warn("[{}] could not push error: {}", ctx.connectionId(), e.toString());
    }
  }

  @Override
  public void onTerminated(Session session, TerminationReason reason) {
    synchronized (this) {
      String key = keyOf(session);
      if (key == null) return;
      if (reason == TerminationReason.CRASHED && !closed) {
        sessionsByTopic.put(key, factory.create(ctx, connection, this));
        log.info("[{}] session for {} restarted after crash", ctx.connectionId(), key);
      } else {
        sessionsByTopic.remove(key);
      }
    }
  }

  /** Terminates every session. Later frames are ignored. */
  public void close(TerminationReason reason) {
    List<Session> toClose;
    synchronized (this) {
      if (closed) return;
      closed = true;
      toClose = new ArrayList<>(sessionsByTopic.values());
      sessionsByTopic.clear();
    }
    for (Session s : toClose) s.close(reason);
    log.debug(
        "[{}] connection closed ({}), {} session(s) ended",
        ctx.connectionId(),
        reason.wireName(),
        toClose.size());
  }

  public synchronized Optional<Session> session(String topic) {
    return Optional.ofNullable(sessionsByTopic.get(topicKey(topic)));
  }

  public synchronized int sessionCount() {
    return sessionsByTopic.size();
  }

  private Session onlySession() {
    if (sessionsByTopic.size() != 1) return null;
    return sessionsByTopic.values().iterator().next();
  }

  private String keyOf(Session session) {
    Iterator<Map.Entry<String, Session>> it = sessionsByTopic.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, Session> e = it.next();
      if (e.getValue() == session) return e.getKey();
    }
    return null;
  }

  private static String topicKey(String raw) {
    String s = Objects.toString(raw, "").trim();
    return TopicRef.parse(s).map(TopicRef::value).orElse(s);
  }
}
