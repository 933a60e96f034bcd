package cafe.woden.huddle.session;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Authenticated output of the transport handshake. */
@ValueObject
public record ConnectionContext(String connectionId, String identity, String deviceId) {
  public ConnectionContext {
    connectionId = Objects.toString(connectionId, "").trim();
    identity = Objects.toString(identity, "").trim();
    deviceId = Objects.toString(deviceId, "").trim();
    if (connectionId.isEmpty()) throw new IllegalArgumentException("connectionId is blank");
    if (identity.isEmpty()) throw new IllegalArgumentException("identity is blank");
    if (deviceId.isEmpty()) deviceId = connectionId;
  }
}
