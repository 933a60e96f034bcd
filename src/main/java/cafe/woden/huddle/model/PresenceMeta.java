package cafe.woden.huddle.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** One device's presence record for an identity within a topic. */
@ValueObject
public record PresenceMeta(String deviceId, PresenceStatus status, Instant joinedAt) {

  public PresenceMeta {
    deviceId = Objects.requireNonNull(deviceId, "deviceId").trim();
    if (deviceId.isEmpty()) throw new IllegalArgumentException("deviceId is blank");
    if (status == null) status = PresenceStatus.ONLINE;
    if (joinedAt == null) joinedAt = Instant.EPOCH;
  }

  public PresenceMeta withStatus(PresenceStatus next) {
    return new PresenceMeta(deviceId, next, joinedAt);
  }
}
