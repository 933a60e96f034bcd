package cafe.woden.huddle.session;

public enum SessionState {
  CONNECTING,
  JOINING,
  JOINED,
  TERMINATED
}
