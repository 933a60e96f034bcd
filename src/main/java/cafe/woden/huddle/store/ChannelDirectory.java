package cafe.woden.huddle.store;

import cafe.woden.huddle.model.TopicRef;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Membership and channel metadata owned by the account/workspace services.
 *
 * <p>Implementations may block; callers invoke them off the topic inbox.
 */
@ApplicationLayer
public interface ChannelDirectory {

  /** True if the workspace or channel behind {@code topic} exists. */
  boolean exists(TopicRef topic);

  /**
   * Active membership: workspace membership for a workspace topic, explicit channel membership for
   * a channel topic.
   */
  boolean isMember(String identity, TopicRef topic);

  ChannelVisibility visibility(TopicRef channel);

  boolean isArchived(TopicRef channel);

  /** Workspace id that owns {@code channel}, empty for unknown channels. */
  Optional<String> workspaceOf(TopicRef channel);

  boolean isAdmin(String identity, String workspaceId);
}
