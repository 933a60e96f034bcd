package cafe.woden.huddle.topic;

import cafe.woden.huddle.broadcast.Subscription;
import cafe.woden.huddle.model.PresenceMeta;
import java.util.List;
import java.util.Map;

/**
 * Result of joining a topic owner: the subscription and the presence snapshot taken in the same
 * inbox turn, so the snapshot already contains the member's own meta.
 */
public record JoinTicket(Subscription subscription, Map<String, List<PresenceMeta>> presence) {
  public JoinTicket {
    presence = presence == null ? Map.of() : presence;
  }
}
