package cafe.woden.huddle.session;

import cafe.woden.huddle.auth.AuthorizationGate;
import cafe.woden.huddle.config.ExecutorConfig;
import cafe.woden.huddle.config.HuddleProperties;
import cafe.woden.huddle.store.MessageStore;
import cafe.woden.huddle.topic.TopicRegistry;
import io.reactivex.rxjava3.core.Scheduler;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Creates sessions wired to the shared collaborators and schedulers. */
@Component
@ApplicationLayer
public class SessionFactory {

  final AuthorizationGate gate;
  final TopicRegistry registry;
  final MessageStore store;
  final Scheduler sessionScheduler;
  final Scheduler timeoutScheduler;
  final HuddleProperties.Realtime settings;
  final Clock clock;

  private final AtomicLong sessionIds = new AtomicLong();

  @Autowired
  public SessionFactory(
      AuthorizationGate gate,
      TopicRegistry registry,
      MessageStore store,
      @Qualifier(ExecutorConfig.SESSION_SCHEDULER) Scheduler sessionScheduler,
      @Qualifier(ExecutorConfig.STORE_TIMEOUT_SCHEDULER) Scheduler timeoutScheduler,
      HuddleProperties props) {
    this(
        gate,
        registry,
        store,
        sessionScheduler,
        timeoutScheduler,
        props.realtime(),
        Clock.systemUTC());
  }

  public SessionFactory(
      AuthorizationGate gate,
      TopicRegistry registry,
      MessageStore store,
      Scheduler sessionScheduler,
      Scheduler timeoutScheduler,
      HuddleProperties.Realtime settings,
      Clock clock) {
    this.gate = Objects.requireNonNull(gate, "gate");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.store = Objects.requireNonNull(store, "store");
    this.sessionScheduler = Objects.requireNonNull(sessionScheduler, "sessionScheduler");
    this.timeoutScheduler = Objects.requireNonNull(timeoutScheduler, "timeoutScheduler");
    this.settings = settings == null ? HuddleProperties.Realtime.defaults() : settings;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** New session in {@link SessionState#CONNECTING}. */
  public Session create(ConnectionContext ctx, Connection connection, SessionListener listener) {
    String id = ctx.connectionId() + "#" + sessionIds.incrementAndGet();
    return new Session(this, id, ctx, connection, listener);
  }
}
