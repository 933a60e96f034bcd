package cafe.woden.huddle.store;

import cafe.woden.huddle.model.TopicRef;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link ChannelDirectory}.
 *
 * <p>Populated at startup from {@code huddle.directory} (see {@link DirectorySeeder}) or directly
 * by tests. Identities and ids are matched exactly after trimming.
 */
@Component
@InfrastructureLayer
public class InMemoryChannelDirectory implements ChannelDirectory {

  private record ChannelRecord(
      String workspaceId, ChannelVisibility visibility, boolean archived) {}

  private final Map<String, Set<String>> membersByWorkspace = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> adminsByWorkspace = new ConcurrentHashMap<>();
  private final Map<String, ChannelRecord> channels = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> membersByChannel = new ConcurrentHashMap<>();

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }

  public void putWorkspace(String workspaceId) {
    String ws = norm(workspaceId);
    if (ws.isEmpty()) throw new IllegalArgumentException("workspaceId is blank");
    membersByWorkspace.computeIfAbsent(ws, k -> ConcurrentHashMap.newKeySet());
    adminsByWorkspace.computeIfAbsent(ws, k -> ConcurrentHashMap.newKeySet());
  }

  public void addWorkspaceMember(String workspaceId, String identity) {
    putWorkspace(workspaceId);
    membersByWorkspace.get(norm(workspaceId)).add(norm(identity));
  }

  public void removeWorkspaceMember(String workspaceId, String identity) {
    Set<String> members = membersByWorkspace.get(norm(workspaceId));
    if (members != null) members.remove(norm(identity));
  }

  /** Admins are members too. */
  public void grantAdmin(String workspaceId, String identity) {
    addWorkspaceMember(workspaceId, identity);
    adminsByWorkspace.get(norm(workspaceId)).add(norm(identity));
  }

  public void putChannel(String channelId, String workspaceId, ChannelVisibility visibility) {
    String ch = norm(channelId);
    if (ch.isEmpty()) throw new IllegalArgumentException("channelId is blank");
    putWorkspace(workspaceId);
    ChannelVisibility v = visibility == null ? ChannelVisibility.PUBLIC : visibility;
    channels.put(ch, new ChannelRecord(norm(workspaceId), v, false));
    membersByChannel.computeIfAbsent(ch, k -> ConcurrentHashMap.newKeySet());
  }

  public void addChannelMember(String channelId, String identity) {
    Set<String> members = membersByChannel.get(norm(channelId));
    if (members == null) throw new IllegalArgumentException("unknown channel: " + channelId);
    members.add(norm(identity));
  }

  public void setArchived(String channelId, boolean archived) {
    channels.computeIfPresent(
        norm(channelId),
        (k, rec) -> new ChannelRecord(rec.workspaceId(), rec.visibility(), archived));
  }

  @Override
  public boolean exists(TopicRef topic) {
    if (topic == null) return false;
    return topic.isWorkspace()
        ? membersByWorkspace.containsKey(topic.id())
        : channels.containsKey(topic.id());
  }

  @Override
  public boolean isMember(String identity, TopicRef topic) {
    if (topic == null) return false;
    Set<String> members =
        topic.isWorkspace() ? membersByWorkspace.get(topic.id()) : membersByChannel.get(topic.id());
    return members != null && members.contains(norm(identity));
  }

  @Override
  public ChannelVisibility visibility(TopicRef channel) {
    ChannelRecord rec = channel == null ? null : channels.get(channel.id());
    return rec == null ? ChannelVisibility.PUBLIC : rec.visibility();
  }

  @Override
  public boolean isArchived(TopicRef channel) {
    ChannelRecord rec = channel == null ? null : channels.get(channel.id());
    return rec != null && rec.archived();
  }

  @Override
  public Optional<String> workspaceOf(TopicRef channel) {
    if (channel == null || !channel.isChannel()) return Optional.empty();
    ChannelRecord rec = channels.get(channel.id());
    return rec == null ? Optional.empty() : Optional.of(rec.workspaceId());
  }

  @Override
  public boolean isAdmin(String identity, String workspaceId) {
    Set<String> admins = adminsByWorkspace.get(norm(workspaceId));
    return admins != null && admins.contains(norm(identity));
  }
}
