package cafe.woden.huddle.model;

import java.util.Objects;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Identifies a topic: {@code workspace:<id>} or {@code channel:<id>}.
 *
 * <p>Topic ids are case-sensitive and kept exactly as given (after trimming). Any other shape is
 * rejected by {@link #parse(String)}.
 */
@ValueObject
public final class TopicRef {

  private final TopicKind kind;
  private final String id;

  private TopicRef(TopicKind kind, String id) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.id = norm(id);
    if (this.id.isEmpty()) throw new IllegalArgumentException("topic id must not be blank");
    if (this.id.indexOf(':') >= 0) {
      throw new IllegalArgumentException("topic id must not contain ':' (" + this.id + ")");
    }
  }

  public static TopicRef workspace(String workspaceId) {
    return new TopicRef(TopicKind.WORKSPACE, workspaceId);
  }

  public static TopicRef channel(String channelId) {
    return new TopicRef(TopicKind.CHANNEL, channelId);
  }

  /** Parses a wire topic string. Returns empty for anything that is not {@code kind:id}. */
  public static Optional<TopicRef> parse(String raw) {
    String s = norm(raw);
    int colon = s.indexOf(':');
    if (colon <= 0 || colon >= s.length() - 1) return Optional.empty();

    TopicKind kind = TopicKind.fromPrefix(s.substring(0, colon));
    if (kind == null) return Optional.empty();

    String id = s.substring(colon + 1).trim();
    if (id.isEmpty() || id.indexOf(':') >= 0) return Optional.empty();
    return Optional.of(new TopicRef(kind, id));
  }

  public TopicKind kind() {
    return kind;
  }

  public String id() {
    return id;
  }

  public boolean isWorkspace() {
    return kind == TopicKind.WORKSPACE;
  }

  public boolean isChannel() {
    return kind == TopicKind.CHANNEL;
  }

  /** Wire form, e.g. {@code channel:general}. */
  public String value() {
    return kind.prefix() + ":" + id;
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TopicRef other)) return false;
    return kind == other.kind && id.equals(other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, id);
  }

  @Override
  public String toString() {
    return value();
  }
}
