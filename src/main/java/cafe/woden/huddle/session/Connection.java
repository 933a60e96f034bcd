package cafe.woden.huddle.session;

/**
 * Outbound side of a client connection.
 *
 * <p>Sessions of the same connection push from their own drain workers, so implementations must
 * accept concurrent calls.
 */
@FunctionalInterface
public interface Connection {
  void push(ServerPush push);
}
