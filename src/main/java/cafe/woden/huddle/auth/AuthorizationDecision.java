package cafe.woden.huddle.auth;

import java.util.Objects;

/** Outcome of a join authorization check. */
public sealed interface AuthorizationDecision
    permits AuthorizationDecision.Allow, AuthorizationDecision.Deny {

  static AuthorizationDecision allow() {
    return Allow.INSTANCE;
  }

  static AuthorizationDecision deny(String reason) {
    return new Deny(reason);
  }

  default boolean allowed() {
    return this instanceof Allow;
  }

  final class Allow implements AuthorizationDecision {
    private static final Allow INSTANCE = new Allow();

    private Allow() {}

    @Override
    public String toString() {
      return "Allow";
    }
  }

  /** Denied; {@code reason} is the wire reason pushed with the join error. */
  record Deny(String reason) implements AuthorizationDecision {
    public Deny {
      reason = Objects.toString(reason, "").trim();
      if (reason.isEmpty()) reason = "unauthorized";
    }
  }
}
