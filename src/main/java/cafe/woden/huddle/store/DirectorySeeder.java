package cafe.woden.huddle.store;

import cafe.woden.huddle.config.HuddleProperties;
import jakarta.annotation.PostConstruct;
import java.util.Objects;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/** Loads {@code huddle.directory} into the in-memory directory at startup. */
@Component
@Lazy(false)
@InfrastructureLayer
class DirectorySeeder {
  private static final Logger log = LoggerFactory.getLogger(DirectorySeeder.class);

  private final HuddleProperties props;
  private final InMemoryChannelDirectory directory;

  DirectorySeeder(HuddleProperties props, InMemoryChannelDirectory directory) {
    this.props = Objects.requireNonNull(props, "props");
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @PostConstruct
  void seed() {
    int channels = 0;
    for (HuddleProperties.Workspace ws : props.directory().workspaces()) {
      directory.putWorkspace(ws.id());
      ws.members().forEach(m -> directory.addWorkspaceMember(ws.id(), m));
      ws.admins().forEach(a -> directory.grantAdmin(ws.id(), a));
      for (HuddleProperties.Channel ch : ws.channels()) {
        directory.putChannel(ch.id(), ws.id(), ChannelVisibility.fromConfig(ch.visibility()));
        ch.members().forEach(m -> directory.addChannelMember(ch.id(), m));
        if (ch.archived()) directory.setArchived(ch.id(), true);
        channels++;
      }
    }
    log.info(
        "[huddle] directory seeded: {} workspace(s), {} channel(s)",
        props.directory().workspaces().size(),
        channels);
  }
}
