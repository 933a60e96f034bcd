package cafe.woden.huddle.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import cafe.woden.huddle.model.ErrorKind;
import cafe.woden.huddle.model.RealtimeException;
import cafe.woden.huddle.model.TopicRef;
import cafe.woden.huddle.store.ChannelDirectory;
import cafe.woden.huddle.store.ChannelVisibility;
import cafe.woden.huddle.store.InMemoryChannelDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuthorizationGateTest {

  private InMemoryChannelDirectory directory;
  private AuthorizationGate gate;

  @BeforeEach
  void setUp() {
    directory = new InMemoryChannelDirectory();
    directory.addWorkspaceMember("acme", "member");
    directory.addWorkspaceMember("acme", "insider");
    directory.grantAdmin("acme", "admin");
    directory.putWorkspace("other");
    directory.addWorkspaceMember("other", "stranger");

    directory.putChannel("general", "acme", ChannelVisibility.PUBLIC);
    directory.putChannel("secret", "acme", ChannelVisibility.PRIVATE);
    directory.addChannelMember("secret", "insider");
    directory.putChannel("old", "acme", ChannelVisibility.PUBLIC);
    directory.setArchived("old", true);
    gate = new AuthorizationGate(directory);
  }

  @Test
  void workspaceRequiresMembership() {
    assertAllowed("member", "workspace:acme");
    assertDenied("stranger", "workspace:acme", "unauthorized");
  }

  @Test
  void publicChannelRequiresWorkspaceMembership() {
    assertAllowed("member", "channel:general");
    assertDenied("stranger", "channel:general", "unauthorized");
  }

  @Test
  void privateChannelRequiresExplicitMembership() {
    assertAllowed("insider", "channel:secret");
    assertDenied("member", "channel:secret", "unauthorized");
  }

  @Test
  void archivedChannelAdmitsOnlyWorkspaceAdmins() {
    assertAllowed("admin", "channel:old");
    assertDenied("member", "channel:old", "archived");
    assertDenied("stranger", "channel:old", "archived");
  }

  @Test
  void unknownOrMalformedTopicsAreNotFound() {
    assertDenied("member", "channel:nope", "not_found");
    assertDenied("member", "workspace:nope", "not_found");
    assertDenied("member", "room:general", "not_found");
    assertDenied("member", "general", "not_found");
    assertDenied("member", null, "not_found");
  }

  @Test
  void decisionsFollowDirectoryChangesImmediately() {
    assertDenied("member", "channel:secret", "unauthorized");
    directory.addChannelMember("secret", "member");
    assertAllowed("member", "channel:secret");

    directory.removeWorkspaceMember("acme", "member");
    assertDenied("member", "channel:general", "unauthorized");
  }

  @Test
  void directoryFailuresSurfaceAsStoreFailure() {
    ChannelDirectory broken = mock(ChannelDirectory.class);
    when(broken.exists(any(TopicRef.class))).thenThrow(new IllegalStateException("db down"));

    RealtimeException e =
        assertThrows(
            RealtimeException.class,
            () -> new AuthorizationGate(broken).authorize("member", "channel:general"));
    assertEquals(ErrorKind.STORE_FAILURE, e.kind());
  }

  private void assertAllowed(String identity, String topic) {
    assertTrue(gate.authorize(identity, topic).allowed(), identity + " -> " + topic);
  }

  private void assertDenied(String identity, String topic, String reason) {
    AuthorizationDecision.Deny deny =
        assertInstanceOf(AuthorizationDecision.Deny.class, gate.authorize(identity, topic));
    assertEquals(reason, deny.reason(), identity + " -> " + topic);
  }
}
