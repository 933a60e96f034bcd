package cafe.woden.huddle.topic;

import cafe.woden.huddle.config.ExecutorConfig;
import cafe.woden.huddle.config.HuddleProperties;
import cafe.woden.huddle.model.TopicRef;
import io.reactivex.rxjava3.core.Scheduler;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Creates one {@link TopicOwner} per live topic.
 *
 * <p>An owner is started on the first {@link #acquire} and shut down when its last member is
 * {@link #release released}. If an owner fails, a replacement takes over with sequence numbers
 * continuing after the failed owner's tail, and every member is told to join again.
 */
@Component
@ApplicationLayer
public class TopicRegistry implements TopicOwner.FailureListener {
  private static final Logger log = LoggerFactory.getLogger(TopicRegistry.class);

  private static final class Entry {
    TopicOwner owner;
    final Set<TopicMember> members = new LinkedHashSet<>();

    Entry(TopicOwner owner) {
      this.owner = owner;
    }
  }

  private final Scheduler scheduler;
  private final Duration typingTimeout;
  private final Map<TopicRef, Entry> entries = new HashMap<>();

  @Autowired
  public TopicRegistry(
      @Qualifier(ExecutorConfig.TOPIC_SCHEDULER) Scheduler scheduler, HuddleProperties props) {
    this(scheduler, props.realtime().typingTimeout());
  }

  public TopicRegistry(Scheduler scheduler, Duration typingTimeout) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.typingTimeout = Objects.requireNonNull(typingTimeout, "typingTimeout");
  }

  /** Registers {@code member} on {@code topic} and returns the topic's current owner. */
  public synchronized TopicOwner acquire(TopicRef topic, TopicMember member) {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(member, "member");
    Entry entry = entries.get(topic);
    if (entry == null) {
      entry = new Entry(newOwner(topic, 0));
      entries.put(topic, entry);
      log.debug("[{}] topic owner started", topic);
    }
    entry.members.add(member);
    return entry.owner;
  }

  /** Drops {@code member}; shuts the owner down once nobody is left. Idempotent. */
  public synchronized void release(TopicRef topic, TopicMember member) {
    if (topic == null) return;
    Entry entry = entries.get(topic);
    if (entry == null || !entry.members.remove(member)) return;
    if (!entry.members.isEmpty()) return;

    entries.remove(topic);
    var unused =
        entry.owner.shutdown().subscribe(() -> log.debug("[{}] topic owner stopped", topic));
  }

  public synchronized Optional<TopicOwner> ownerOf(TopicRef topic) {
    Entry entry = entries.get(topic);
    return entry == null ? Optional.empty() : Optional.of(entry.owner);
  }

  public synchronized int memberCount(TopicRef topic) {
    Entry entry = entries.get(topic);
    return entry == null ? 0 : entry.members.size();
  }

  public synchronized int activeTopicCount() {
    return entries.size();
  }

  @Override
  public void onOwnerFailed(TopicOwner failed, long tailSeq, Throwable cause) {
    TopicOwner replacement;
    List<TopicMember> toNotify;
    synchronized (this) {
      Entry entry = entries.get(failed.topic());
      if (entry == null || entry.owner != failed) return;
      replacement = newOwner(failed.topic(), tailSeq);
      entry.owner = replacement;
      toNotify = List.copyOf(entry.members);
    }
    log.warn(
        "[{}] topic owner replaced after failure; seq continues after {}, {} member(s) to rejoin",
        failed.topic(),
        tailSeq,
        toNotify.size());
    for (TopicMember member : toNotify) {
      try {
        member.onOwnerRestarted(replacement);
      } catch (RuntimeException e) {
        log.error("[{}] member {} failed to handle owner restart", failed.topic(), member, e);
      }
    }
  }

  @PreDestroy
  public void shutdown() {
    List<TopicOwner> owners;
    synchronized (this) {
      owners = entries.values().stream().map(e -> e.owner).toList();
      entries.clear();
    }
    for (TopicOwner owner : owners) {
      var unused = owner.shutdown().subscribe();
    }
    if (!owners.isEmpty()) log.info("[huddle] stopped {} topic owner(s)", owners.size());
  }

  private TopicOwner newOwner(TopicRef topic, long initialSeq) {
    return new TopicOwner(topic, initialSeq, scheduler, typingTimeout, this);
  }
}
