package cafe.woden.huddle.model;

import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Classified failure raised by collaborators and the session boundary.
 *
 * <p>{@link #reason()} is the wire reason pushed to the client; it defaults to the kind's reason
 * but may be more specific (e.g. {@code archived}, {@code store_timeout}).
 */
public class RealtimeException extends RuntimeException {

  public static final String STORE_TIMEOUT = "store_timeout";

  private final ErrorKind kind;
  private final String reason;

  public RealtimeException(ErrorKind kind, String reason, String message) {
    this(kind, reason, message, null);
  }

  public RealtimeException(ErrorKind kind, String reason, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    String r = Objects.toString(reason, "").trim();
    this.reason = r.isEmpty() ? kind.defaultReason() : r;
  }

  public static RealtimeException unauthorized(String message) {
    return new RealtimeException(ErrorKind.UNAUTHORIZED, null, message);
  }

  public static RealtimeException notFound(String message) {
    return new RealtimeException(ErrorKind.NOT_FOUND, null, message);
  }

  public static RealtimeException invalid(String message) {
    return new RealtimeException(ErrorKind.INVALID, null, message);
  }

  public static RealtimeException storeFailure(String message, Throwable cause) {
    return new RealtimeException(ErrorKind.STORE_FAILURE, null, message, cause);
  }

  /**
   * Maps any failure from an asynchronous collaborator call onto the taxonomy. Timeouts become
   * {@code store_timeout}; unclassified failures become {@code store_failure}.
   */
  public static RealtimeException classify(Throwable t) {
    if (t instanceof RealtimeException re) return re;
    if (t instanceof TimeoutException) {
      return new RealtimeException(
          ErrorKind.STORE_FAILURE, STORE_TIMEOUT, "store call timed out", t);
    }
    String message = t == null ? null : t.getMessage();
    return storeFailure(Objects.toString(message, "store call failed"), t);
  }

  public ErrorKind kind() {
    return kind;
  }

  public String reason() {
    return reason;
  }
}
