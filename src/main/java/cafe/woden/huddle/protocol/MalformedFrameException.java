package cafe.woden.huddle.protocol;

import cafe.woden.huddle.model.ErrorKind;
import cafe.woden.huddle.model.RealtimeException;

/** A client frame that could not be decoded. Carries what could be salvaged for the reply. */
public class MalformedFrameException extends RealtimeException {

  private final String op;
  private final String topic;
  private final String clientRef;

  public MalformedFrameException(String message, String op, String topic, String clientRef) {
    super(ErrorKind.INVALID, null, message);
    this.op = op == null ? "" : op;
    this.topic = topic == null ? "" : topic;
    this.clientRef = clientRef;
  }

  public String op() {
    return op;
  }

  public String topic() {
    return topic;
  }

  public String clientRef() {
    return clientRef;
  }
}
