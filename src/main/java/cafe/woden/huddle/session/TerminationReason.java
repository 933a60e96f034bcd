package cafe.woden.huddle.session;

import java.util.Locale;

/** Why a session ended. */
public enum TerminationReason {
  LEFT,
  CONNECTION_CLOSED,
  JOIN_DENIED,
  BACKPRESSURE,
  CRASHED,
  SHUTDOWN;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
