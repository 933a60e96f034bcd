package cafe.woden.huddle.session;

/** Told once when a session has terminated. */
@FunctionalInterface
public interface SessionListener {
  void onTerminated(Session session, TerminationReason reason);
}
