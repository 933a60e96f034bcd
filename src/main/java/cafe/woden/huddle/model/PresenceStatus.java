package cafe.woden.huddle.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

public enum PresenceStatus {
  ONLINE,
  AWAY,
  BUSY;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<PresenceStatus> fromWire(String raw) {
    String s = Objects.toString(raw, "").trim().toUpperCase(Locale.ROOT);
    if (s.isEmpty()) return Optional.empty();
    try {
      return Optional.of(valueOf(s));
    } catch (IllegalArgumentException unknown) {
      return Optional.empty();
    }
  }
}
