package cafe.woden.huddle.protocol;

/** Transport side of a connection: sends one encoded text frame. */
@FunctionalInterface
public interface FrameSink {
  void send(String text);
}
