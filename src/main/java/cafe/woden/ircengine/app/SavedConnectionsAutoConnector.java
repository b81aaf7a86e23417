package cafe.woden.ircengine.app;

import cafe.woden.ircengine.config.IrcEngineProperties;
import cafe.woden.ircengine.config.SavedConnectionStore;
import cafe.woden.ircengine.connection.ConnectionConfig;
import cafe.woden.ircengine.connection.ConnectionRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Connects every saved profile once at startup when {@code auto-connect-saved} is on. */
@Component
public class SavedConnectionsAutoConnector implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(SavedConnectionsAutoConnector.class);

  private final IrcEngineProperties props;
  private final SavedConnectionStore savedConnections;
  private final ConnectionRegistry registry;

  public SavedConnectionsAutoConnector(
      IrcEngineProperties props,
      SavedConnectionStore savedConnections,
      ConnectionRegistry registry) {
    this.props = props;
    this.savedConnections = savedConnections;
    this.registry = registry;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!props.client().autoConnectSaved()) return;
    List<ConnectionConfig> profiles = savedConnections.list();
    log.info("Auto-connecting {} saved connection(s)", profiles.size());
    for (ConnectionConfig config : profiles) {
      try {
        registry.connect(config);
      } catch (RuntimeException e) {
        log.warn("Auto-connect failed for {}", config.storageKey(), e);
      }
    }
  }
}
