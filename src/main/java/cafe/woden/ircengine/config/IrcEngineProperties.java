package cafe.woden.ircengine.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine configuration.
 *
 * <p>Example YAML:
 * <pre>
 * ircengine:
 *   client:
 *     event-topic: "irc://event"
 *     tls:
 *       trust-all-certificates: false
 *   storage:
 *     data-dir: "/home/me/.ircengine"
 * </pre>
 */
@ConfigurationProperties(prefix = "ircengine")
public record IrcEngineProperties(Client client, Storage storage) {

  public static final String DEFAULT_EVENT_TOPIC = "irc://event";

  public record Client(String eventTopic, Boolean tcpNoDelay, Boolean autoConnectSaved, Tls tls) {

    /** TLS settings for IRC-over-TLS sockets. */
    public record Tls(boolean trustAllCertificates) {}

    public Client {
      if (eventTopic == null || eventTopic.isBlank()) eventTopic = DEFAULT_EVENT_TOPIC;
      if (tcpNoDelay == null) tcpNoDelay = Boolean.TRUE;
      if (autoConnectSaved == null) autoConnectSaved = Boolean.FALSE;
      if (tls == null) tls = new Tls(false);
    }
  }

  /** Where scrollback and saved profiles live. */
  public record Storage(String dataDir, String scrollbackDirName, String connectionsFileName) {
    public Storage {
      if (dataDir == null || dataDir.isBlank()) {
        dataDir = Path.of(System.getProperty("user.home", "."), ".ircengine").toString();
      }
      if (scrollbackDirName == null || scrollbackDirName.isBlank()) {
        scrollbackDirName = "scrollback";
      }
      if (connectionsFileName == null || connectionsFileName.isBlank()) {
        connectionsFileName = "connections.json";
      }
    }

    public Path scrollbackDir() {
      return Path.of(dataDir).resolve(scrollbackDirName);
    }

    public Path connectionsFile() {
      return Path.of(dataDir).resolve(connectionsFileName);
    }
  }

  public IrcEngineProperties {
    if (client == null) client = new Client(null, null, null, null);
    if (storage == null) storage = new Storage(null, null, null);
  }
}
