package cafe.woden.huddle.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Occupancy delta for a topic: metas added under {@code joins}, metas removed under {@code leaves},
 * both keyed by identity.
 */
@ValueObject
public record PresenceDiff(
    Map<String, List<PresenceMeta>> joins, Map<String, List<PresenceMeta>> leaves) {

  private static final PresenceDiff EMPTY = new PresenceDiff(Map.of(), Map.of());

  public PresenceDiff {
    joins = freeze(joins);
    leaves = freeze(leaves);
  }

  public static PresenceDiff empty() {
    return EMPTY;
  }

  public static PresenceDiff join(String identity, PresenceMeta meta) {
    return new PresenceDiff(Map.of(identity, List.of(meta)), Map.of());
  }

  public static PresenceDiff leave(String identity, PresenceMeta meta) {
    return new PresenceDiff(Map.of(), Map.of(identity, List.of(meta)));
  }

  public static PresenceDiff replace(String identity, PresenceMeta before, PresenceMeta after) {
    return new PresenceDiff(Map.of(identity, List.of(after)), Map.of(identity, List.of(before)));
  }

  public boolean isEmpty() {
    return joins.isEmpty() && leaves.isEmpty();
  }

  private static Map<String, List<PresenceMeta>> freeze(Map<String, List<PresenceMeta>> in) {
    if (in == null || in.isEmpty()) return Map.of();
    LinkedHashMap<String, List<PresenceMeta>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<PresenceMeta>> e : in.entrySet()) {
      if (e.getKey() == null || e.getValue() == null || e.getValue().isEmpty()) continue;
      copy.put(e.getKey(), List.copyOf(e.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }
}
