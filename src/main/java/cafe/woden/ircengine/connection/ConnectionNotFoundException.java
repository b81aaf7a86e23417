package cafe.woden.ircengine.connection;

/** No live connection is registered under the given id. */
public class ConnectionNotFoundException extends IllegalArgumentException {

  private final String connectionId;

  public ConnectionNotFoundException(String connectionId) {
    super("connection not found: " + connectionId);
    this.connectionId = connectionId;
  }

  public String connectionId() {
    return connectionId;
  }
}
