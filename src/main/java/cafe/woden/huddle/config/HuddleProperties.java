package cafe.woden.huddle.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Realtime layer configuration.
 *
 * <p>Example YAML:
 * <pre>
 * huddle:
 *   realtime:
 *     typing-timeout: 5s
 *     outbound-queue-capacity: 256
 *   directory:
 *     workspaces:
 *       - id: acme
 *         members: [u1, u2]
 *         admins: [u1]
 *         channels:
 *           - id: general
 *             visibility: public
 * </pre>
 */
@ConfigurationProperties(prefix = "huddle")
public record HuddleProperties(Realtime realtime, Directory directory) {

  public HuddleProperties {
    if (realtime == null) {
      realtime = new Realtime(null, 0, null, 0, 0);
    }
    if (directory == null) {
      directory = new Directory(List.of());
    }
  }

  public record Realtime(
      Duration typingTimeout,
      int outboundQueueCapacity,
      Duration storeTimeout,
      int recentMessageLimit,
      int olderMessageLimit) {

    public static final Duration DEFAULT_TYPING_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STORE_TIMEOUT = Duration.ofSeconds(5);

    public Realtime {
      if (typingTimeout == null || typingTimeout.isZero() || typingTimeout.isNegative()) {
        typingTimeout = DEFAULT_TYPING_TIMEOUT;
      }
      if (outboundQueueCapacity <= 0) outboundQueueCapacity = 256;
      if (storeTimeout == null || storeTimeout.isZero() || storeTimeout.isNegative()) {
        storeTimeout = DEFAULT_STORE_TIMEOUT;
      }
      if (recentMessageLimit <= 0) recentMessageLimit = 50;
      if (olderMessageLimit <= 0) olderMessageLimit = 20;
    }

    public static Realtime defaults() {
      return new Realtime(null, 0, null, 0, 0);
    }
  }

  /** Seed data for the in-memory channel directory. */
  public record Directory(List<Workspace> workspaces) {
    public Directory {
      workspaces = workspaces == null ? List.of() : List.copyOf(workspaces);
    }
  }

  public record Workspace(
      String id, List<String> members, List<String> admins, List<Channel> channels) {
    public Workspace {
      if (id == null || id.isBlank()) {
        throw new IllegalArgumentException("huddle.directory.workspaces[].id is blank");
      }
      members = members == null ? List.of() : List.copyOf(members);
      admins = admins == null ? List.of() : List.copyOf(admins);
      channels = channels == null ? List.of() : List.copyOf(channels);
    }
  }

  public record Channel(String id, String visibility, boolean archived, List<String> members) {
    public Channel {
      if (id == null || id.isBlank()) {
        throw new IllegalArgumentException("huddle.directory channel id is blank");
      }
      if (visibility == null || visibility.isBlank()) visibility = "public";
      members = members == null ? List.of() : List.copyOf(members);
    }
  }
}
