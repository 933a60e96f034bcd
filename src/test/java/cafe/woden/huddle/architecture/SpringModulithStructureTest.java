package cafe.woden.huddle.architecture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import cafe.woden.huddle.HuddleApp;
import cafe.woden.huddle.auth.AuthorizationGate;
import cafe.woden.huddle.broadcast.TopicBroadcaster;
import cafe.woden.huddle.presence.PresenceTracker;
import cafe.woden.huddle.protocol.ConnectionGateway;
import cafe.woden.huddle.protocol.FrameCodec;
import cafe.woden.huddle.session.Session;
import cafe.woden.huddle.session.SessionFactory;
import cafe.woden.huddle.store.InMemoryMessageStore;
import cafe.woden.huddle.store.MessageStore;
import cafe.woden.huddle.topic.TopicOwner;
import cafe.woden.huddle.topic.TopicRegistry;
import cafe.woden.huddle.typing.TypingCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModule;
import org.springframework.modulith.core.ApplicationModules;

class SpringModulithStructureTest {

  @Test
  void applicationModulesCanBeDiscovered() {
    assertThatCode(() -> ApplicationModules.of(HuddleApp.class)).doesNotThrowAnyException();
  }

  @Test
  void typesResolveToTheirModules() {
    ApplicationModules modules = ApplicationModules.of(HuddleApp.class);

    assertBasePackage(modules, AuthorizationGate.class, "cafe.woden.huddle.auth");
    assertBasePackage(modules, TopicBroadcaster.class, "cafe.woden.huddle.broadcast");
    assertBasePackage(modules, PresenceTracker.class, "cafe.woden.huddle.presence");
    assertBasePackage(modules, TypingCoordinator.class, "cafe.woden.huddle.typing");
    assertBasePackage(modules, TopicOwner.class, "cafe.woden.huddle.topic");
    assertBasePackage(modules, Session.class, "cafe.woden.huddle.session");
    assertBasePackage(modules, FrameCodec.class, "cafe.woden.huddle.protocol");
    assertBasePackage(modules, MessageStore.class, "cafe.woden.huddle.store");

    assertThat(moduleFor(modules, TopicRegistry.class))
        .isEqualTo(moduleFor(modules, TopicOwner.class));
    assertThat(moduleFor(modules, SessionFactory.class))
        .isEqualTo(moduleFor(modules, Session.class));
    assertThat(moduleFor(modules, ConnectionGateway.class))
        .isEqualTo(moduleFor(modules, FrameCodec.class));
    assertThat(moduleFor(modules, InMemoryMessageStore.class))
        .isEqualTo(moduleFor(modules, MessageStore.class));
    assertThat(moduleFor(modules, Session.class))
        .isNotEqualTo(moduleFor(modules, TopicOwner.class));
  }

  @Test
  void moduleVerificationPassesWithCurrentBoundaries() {
    ApplicationModules.of(HuddleApp.class).verify();
  }

  private static void assertBasePackage(
      ApplicationModules modules, Class<?> type, String expectedPackage) {
    assertThat(moduleFor(modules, type).getBasePackage().getName()).isEqualTo(expectedPackage);
  }

  private static ApplicationModule moduleFor(ApplicationModules modules, Class<?> type) {
    return modules
        .getModuleByType(type)
        .orElseThrow(() -> new AssertionError("No module discovered for type " + type.getName()));
  }
}
