package cafe.woden.huddle.model;

/** Failure taxonomy for client-visible errors. */
public enum ErrorKind {
  /** Join denied, or an action on an entity the caller does not own or may not touch. */
  UNAUTHORIZED("unauthorized"),
  /** Unknown topic, message or reaction. */
  NOT_FOUND("not_found"),
  /** Malformed command payload or a command that is not valid in the current state. */
  INVALID("invalid"),
  /** A collaborator call failed or timed out. */
  STORE_FAILURE("store_failure"),
  /** The session's outbound queue overflowed. */
  BACKPRESSURE("backpressure");

  private final String defaultReason;

  ErrorKind(String defaultReason) {
    this.defaultReason = defaultReason;
  }

  public String defaultReason() {
    return defaultReason;
  }
}
