package cafe.woden.huddle.protocol;

import cafe.woden.huddle.session.ClientFrame;
import cafe.woden.huddle.session.ConnectionContext;
import cafe.woden.huddle.session.ConnectionSupervisor;
import cafe.woden.huddle.session.ServerPush;
import cafe.woden.huddle.session.TerminationReason;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** An open client connection as seen by the transport: text in, text out. */
public final class ClientConnection {
  private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

  private final FrameCodec codec;
  private final ConnectionSupervisor supervisor;
  private final Consumer<ClientConnection> onClosed;
  private final AtomicBoolean closed = new AtomicBoolean();

  ClientConnection(
      FrameCodec codec, ConnectionSupervisor supervisor, Consumer<ClientConnection> onClosed) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.onClosed = Objects.requireNonNull(onClosed, "onClosed");
  }

  public ConnectionContext context() {
    return supervisor.context();
  }

  /** Handles one inbound text frame. Malformed frames get an {@code invalid} error. */
  public void receive(String text) {
    if (closed.get()) return;
    ClientFrame frame;
    try {
      frame = codec.decode(text);
    } catch (MalformedFrameException e) {
      log.debug("[{}] malformed frame: {}", context().connectionId(), e.getMessage());
      supervisor.reject(new ServerPush.Error(e.topic(), e.op(), e.reason(), e.clientRef()));
      return;
    }
    supervisor.receive(frame);
  }

  /** Transport closed. Ends every session of this connection. */
  public void close() {
    close(TerminationReason.CONNECTION_CLOSED);
  }

  void close(TerminationReason reason) {
    if (!closed.compareAndSet(false, true)) return;
    supervisor.close(reason);
    onClosed.accept(this);
  }

  public boolean isClosed() {
    return closed.get();
  }

  ConnectionSupervisor supervisor() {
    return supervisor;
  }
}
