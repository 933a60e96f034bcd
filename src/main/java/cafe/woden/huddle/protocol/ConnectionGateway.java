package cafe.woden.huddle.protocol;

import cafe.woden.huddle.session.Connection;
import cafe.woden.huddle.session.ConnectionContext;
import cafe.woden.huddle.session.ConnectionSupervisor;
import cafe.woden.huddle.session.ServerPush;
import cafe.woden.huddle.session.SessionFactory;
import cafe.woden.huddle.session.TerminationReason;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jmolecules.architecture.layered.InterfaceLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for transports.
 *
 * <p>A transport calls {@link #open} once its handshake produced an authenticated identity, feeds
 * inbound text to {@link ClientConnection#receive} and calls {@link ClientConnection#close} when
 * the socket goes away. Outbound frames reach the transport through its {@link FrameSink}.
 */
@Component
@InterfaceLayer
public class ConnectionGateway {
  private static final Logger log = LoggerFactory.getLogger(ConnectionGateway.class);

  private final SessionFactory sessions;
  private final FrameCodec codec;
  private final Set<ClientConnection> open = ConcurrentHashMap.newKeySet();

  public ConnectionGateway(SessionFactory sessions, FrameCodec codec) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public ClientConnection open(ConnectionContext ctx, FrameSink sink) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(sink, "sink");
    ConnectionSupervisor supervisor = new ConnectionSupervisor(ctx, sessions, encoding(sink));
    ClientConnection connection = new ClientConnection(codec, supervisor, open::remove);
    open.add(connection);
    log.info("[{}] connection opened for {}", ctx.connectionId(), ctx.identity());
    return connection;
  }

  public int openConnectionCount() {
    return open.size();
  }

  @PreDestroy
  public void shutdown() {
    List<ClientConnection> all = List.copyOf(open);
    for (ClientConnection c : all) c.close(TerminationReason.SHUTDOWN);
    if (!all.isEmpty()) log.info("[huddle] closed {} connection(s) on shutdown", all.size());
  }

  private Connection encoding(FrameSink sink) {
    return new Connection() {
      @Override
      public void push(ServerPush push) {
        String text = codec.encode(push);
        synchronized (this) {
          sink.send(text);
        }
      }
    };
  }
}
