package cafe.woden.ircengine.connection;

import java.util.Objects;

/**
 * Registry-owned reference to one live session: its id, storage key and command inbox.
 *
 * <p>Ids are generated per connect attempt and never reused.
 */
public final class ConnectionHandle {

  private final IrcSession session;

  ConnectionHandle(IrcSession session) {
    this.session = Objects.requireNonNull(session, "session");
  }

  public String id() {
    return session.connectionId();
  }

  public String storageKey() {
    return session.storageKey();
  }

  public ConnectionConfig config() {
    return session.config();
  }

  public SessionState state() {
    return session.state();
  }

  /** False once the session has started closing; sends will fail from then on. */
  public boolean isLive() {
    return session.acceptingCommands();
  }

  /**
   * Queues {@code command} for the session. Never blocks.
   *
   * @throws ConnectionClosedException if the session no longer accepts commands
   */
  public void send(ConnectionCommand command) {
    session.submit(command);
  }

  IrcSession session() {
    return session;
  }

  @Override
  public String toString() {
    return "ConnectionHandle[" + id() + " " + storageKey() + " " + state() + "]";
  }
}
