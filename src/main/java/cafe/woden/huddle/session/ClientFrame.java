package cafe.woden.huddle.session;

import java.util.Objects;

/**
 * One decoded client frame.
 *
 * @param topic raw topic string, blank when the frame did not carry one
 * @param clientRef correlation id echoed on errors, or null
 */
public record ClientFrame(String topic, String clientRef, ClientCommand command) {
  public ClientFrame {
    topic = Objects.toString(topic, "").trim();
    String ref = Objects.toString(clientRef, "").trim();
    clientRef = ref.isEmpty() ? null : ref;
    Objects.requireNonNull(command, "command");
  }

  public String op() {
    return command.op();
  }
}
