package cafe.woden.ircengine.app;

import cafe.woden.ircengine.config.SavedConnectionStore;
import cafe.woden.ircengine.connection.ConnectionConfig;
import cafe.woden.ircengine.connection.ConnectionHandle;
import cafe.woden.ircengine.connection.ConnectionRegistry;
import cafe.woden.ircengine.logging.ScrollbackStore;
import cafe.woden.ircengine.model.ChatMessage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Command surface of the engine.
 *
 * <p>Routing failures (unknown id, closed session) are thrown synchronously. Network trouble never
 * is; it shows up on the event stream instead.
 */
@Service
public class IrcEngineService {

  private static final Logger log = LoggerFactory.getLogger(IrcEngineService.class);

  private final ConnectionRegistry registry;
  private final SavedConnectionStore savedConnections;
  private final ScrollbackStore scrollback;

  public IrcEngineService(
      ConnectionRegistry registry,
      SavedConnectionStore savedConnections,
      ScrollbackStore scrollback) {
    this.registry = registry;
    this.savedConnections = savedConnections;
    this.scrollback = scrollback;
  }

  /** Saves {@code config} as a profile, then connects (or returns the live session's id). */
  public String connect(ConnectionConfig config) {
    Objects.requireNonNull(config, "config");
    try {
      savedConnections.upsert(config);
    } catch (UncheckedIOException e) {
      // The profile is a convenience; the connection itself doesn't depend on it.
      log.warn("Could not save connection profile {}", config.storageKey(), e);
    }
    return registry.connect(config);
  }

  public void disconnect(String connectionId, String reason) {
    registry.disconnect(connectionId, reason);
  }

  public void join(String connectionId, String channel) {
    registry.join(connectionId, channel);
  }

  public void part(String connectionId, String channel, String reason) {
    registry.part(connectionId, channel, reason);
  }

  public void sendMessage(String connectionId, String target, String message) {
    registry.privmsg(connectionId, target, message);
  }

  public void setTopic(String connectionId, String channel, String topic) {
    registry.setTopic(connectionId, channel, topic);
  }

  /**
   * History for {@code target} on a live connection, oldest first.
   *
   * @param limit most recent entries to return, or null for everything
   */
  public List<ChatMessage> scrollback(String connectionId, String target, Integer limit) {
    ConnectionHandle handle = registry.require(connectionId);
    String t = Objects.toString(target, "").trim();
    if (t.isEmpty()) throw new IllegalArgumentException("target is blank");
    try {
      return limit == null
          ? scrollback.readAll(handle.storageKey(), t)
          : scrollback.readLast(handle.storageKey(), t, limit);
    } catch (IOException e) {
      throw new UncheckedIOException(
          "Could not read scrollback for " + handle.storageKey() + " " + t, e);
    }
  }

  public Set<String> listConnections() {
    return registry.list();
  }

  public List<ConnectionConfig> savedConnections() {
    return savedConnections.list();
  }
}
