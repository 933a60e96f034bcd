package cafe.woden.huddle.presence;

import cafe.woden.huddle.broadcast.TopicBroadcaster;
import cafe.woden.huddle.model.PresenceDiff;
import cafe.woden.huddle.model.PresenceMeta;
import cafe.woden.huddle.model.PresenceStatus;
import cafe.woden.huddle.model.TopicEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Who is present in a topic, one meta per device.
 *
 * <p>An identity is listed iff it has at least one meta. Every call that changes state publishes
 * the resulting diff; calls that change nothing return {@link PresenceDiff#empty()} and publish
 * nothing.
 *
 * <p>Not thread-safe; driven by the owning topic's inbox.
 */
public final class PresenceTracker {

  private final TopicBroadcaster broadcaster;
  private final Map<String, List<PresenceMeta>> metasByIdentity = new LinkedHashMap<>();

  public PresenceTracker(TopicBroadcaster broadcaster) {
    this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
  }

  /** Adds {@code meta}. A device that is already tracked is replaced (leave old, join new). */
  public PresenceDiff track(String identity, PresenceMeta meta) {
    String who = norm(identity);
    Objects.requireNonNull(meta, "meta");
    if (who.isEmpty()) throw new IllegalArgumentException("identity is blank");

    List<PresenceMeta> metas = metasByIdentity.computeIfAbsent(who, k -> new ArrayList<>());
    int existing = indexOf(metas, meta.deviceId());
    PresenceDiff diff;
    if (existing >= 0) {
      PresenceMeta before = metas.set(existing, meta);
      if (before.equals(meta)) return PresenceDiff.empty();
      diff = PresenceDiff.replace(who, before, meta);
    } else {
      metas.add(meta);
      diff = PresenceDiff.join(who, meta);
    }
    return emit(diff);
  }

  public PresenceDiff untrack(String identity, String deviceId) {
    String who = norm(identity);
    List<PresenceMeta> metas = metasByIdentity.get(who);
    if (metas == null) return PresenceDiff.empty();
    int idx = indexOf(metas, deviceId);
    if (idx < 0) return PresenceDiff.empty();

    PresenceMeta removed = metas.remove(idx);
    if (metas.isEmpty()) metasByIdentity.remove(who);
    return emit(PresenceDiff.leave(who, removed));
  }

  /** Replaces the status of one device's meta, reported as leave old + join new. */
  public PresenceDiff updateStatus(String identity, String deviceId, PresenceStatus status) {
    Objects.requireNonNull(status, "status");
    String who = norm(identity);
    List<PresenceMeta> metas = metasByIdentity.get(who);
    if (metas == null) return PresenceDiff.empty();
    int idx = indexOf(metas, deviceId);
    if (idx < 0) return PresenceDiff.empty();

    PresenceMeta before = metas.get(idx);
    if (before.status() == status) return PresenceDiff.empty();
    PresenceMeta after = before.withStatus(status);
    metas.set(idx, after);
    return emit(PresenceDiff.replace(who, before, after));
  }

  /** Current occupancy, identity to metas in tracking order. */
  public Map<String, List<PresenceMeta>> snapshot() {
    LinkedHashMap<String, List<PresenceMeta>> copy = new LinkedHashMap<>();
    metasByIdentity.forEach((who, metas) -> copy.put(who, List.copyOf(metas)));
    return Collections.unmodifiableMap(copy);
  }

  public boolean isPresent(String identity) {
    return metasByIdentity.containsKey(norm(identity));
  }

  public int metaCount() {
    int n = 0;
    for (List<PresenceMeta> metas : metasByIdentity.values()) n += metas.size();
    return n;
  }

  private PresenceDiff emit(PresenceDiff diff) {
    if (!diff.isEmpty()) broadcaster.publish(new TopicEvent.PresenceDiffed(diff));
    return diff;
  }

  private static int indexOf(List<PresenceMeta> metas, String deviceId) {
    String device = norm(deviceId);
    for (int i = 0; i < metas.size(); i++) {
      if (metas.get(i).deviceId().equals(device)) return i;
    }
    return -1;
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }
}
