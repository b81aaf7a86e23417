package cafe.woden.ircengine.connection;

/** The connection is still registered but its session no longer accepts commands. */
public class ConnectionClosedException extends IllegalStateException {

  private final String connectionId;

  public ConnectionClosedException(String connectionId) {
    super("connection channel closed: " + connectionId);
    this.connectionId = connectionId;
  }

  public String connectionId() {
    return connectionId;
  }
}
