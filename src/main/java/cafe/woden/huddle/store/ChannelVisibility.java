package cafe.woden.huddle.store;

import java.util.Locale;
import java.util.Objects;

public enum ChannelVisibility {
  PUBLIC,
  PRIVATE;

  public static ChannelVisibility fromConfig(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    return "private".equals(s) ? PRIVATE : PUBLIC;
  }
}
