package cafe.woden.huddle.auth;

import cafe.woden.huddle.model.ErrorKind;
import cafe.woden.huddle.model.RealtimeException;
import cafe.woden.huddle.model.TopicRef;
import cafe.woden.huddle.store.ChannelDirectory;
import cafe.woden.huddle.store.ChannelVisibility;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether an identity may join a topic.
 *
 * <p>Rules, first match wins, after the topic has been resolved:
 *
 * <ol>
 *   <li>workspace: allow iff the identity is a workspace member
 *   <li>archived channel: allow only workspace admins, otherwise {@code archived}
 *   <li>private channel: allow iff the identity is an explicit channel member
 *   <li>public channel: allow iff the identity is a member of the owning workspace
 * </ol>
 *
 * Unknown or malformed topics are denied with {@code not_found}. Decisions are never cached.
 */
@Component
@ApplicationLayer
public class AuthorizationGate {
  private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

  public static final String REASON_ARCHIVED = "archived";

  private final ChannelDirectory directory;

  public AuthorizationGate(ChannelDirectory directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /** Parses {@code rawTopic}, then authorizes it. Unparseable topics are {@code not_found}. */
  public AuthorizationDecision authorize(String identity, String rawTopic) {
    Optional<TopicRef> topic = TopicRef.parse(rawTopic);
    if (topic.isEmpty()) return AuthorizationDecision.deny(ErrorKind.NOT_FOUND.defaultReason());
    return authorize(identity, topic.get());
  }

  /**
   * @throws RealtimeException of kind {@link ErrorKind#STORE_FAILURE} when the directory fails
   */
  public AuthorizationDecision authorize(String identity, TopicRef topic) {
    String who = Objects.toString(identity, "").trim();
    if (topic == null) return AuthorizationDecision.deny(ErrorKind.NOT_FOUND.defaultReason());
    try {
      AuthorizationDecision decision = decide(who, topic);
      log.debug("[{}] authorize {} -> {}", topic, who, decision);
      return decision;
    } catch (RealtimeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw RealtimeException.storeFailure("channel directory failed for " + topic, e);
    }
  }

  private AuthorizationDecision decide(String identity, TopicRef topic) {
    if (!directory.exists(topic)) {
      return AuthorizationDecision.deny(ErrorKind.NOT_FOUND.defaultReason());
    }
    if (identity.isEmpty()) return unauthorized();

    if (topic.isWorkspace()) {
      return directory.isMember(identity, topic) ? allow() : unauthorized();
    }

    Optional<String> workspaceId = directory.workspaceOf(topic);
    if (directory.isArchived(topic)) {
      boolean admin = workspaceId.map(ws -> directory.isAdmin(identity, ws)).orElse(false);
      return admin ? allow() : AuthorizationDecision.deny(REASON_ARCHIVED);
    }

    if (directory.visibility(topic) == ChannelVisibility.PRIVATE) {
      return directory.isMember(identity, topic) ? allow() : unauthorized();
    }

    boolean workspaceMember =
        workspaceId.map(ws -> directory.isMember(identity, TopicRef.workspace(ws))).orElse(false);
    return workspaceMember ? allow() : unauthorized();
  }

  private static AuthorizationDecision allow() {
    return AuthorizationDecision.allow();
  }

  private static AuthorizationDecision unauthorized() {
    return AuthorizationDecision.deny(ErrorKind.UNAUTHORIZED.defaultReason());
  }
}
