package cafe.woden.huddle.model;

import java.util.Locale;
import java.util.Objects;

/** The two kinds of broadcast domain a client can join. */
public enum TopicKind {
  WORKSPACE("workspace"),
  CHANNEL("channel");

  private final String prefix;

  TopicKind(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }

  /** Returns the kind for a raw prefix, or {@code null} when the prefix is not recognised. */
  public static TopicKind fromPrefix(String raw) {
    String p = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    for (TopicKind kind : values()) {
      if (kind.prefix.equals(p)) return kind;
    }
    return null;
  }
}
