package cafe.woden.ircengine.connection;

import cafe.woden.ircengine.config.ExecutorConfig;
import cafe.woden.ircengine.config.IrcEngineProperties;
import cafe.woden.ircengine.irc.IrcEventSink;
import cafe.woden.ircengine.logging.ChatLogWriter;
import cafe.woden.ircengine.net.IrcTransportFactory;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Process-wide table of live connections, keyed by connection id.
 *
 * <p>All table access happens under one lock and never spans I/O: sessions are started, told to
 * quit and reaped outside it. A session removes its own entry through a termination callback, so
 * ids of dead sessions stop resolving.
 */
@Component
public class ConnectionRegistry {

  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  static final String SHUTDOWN_REASON = "Client shutting down";
  static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(2);

  private final Object lock = new Object();
  private final Map<String, ConnectionHandle> byId = new HashMap<>();

  private final SessionServices services;
  private final ExecutorService sessionExecutor;
  private final Supplier<String> idGenerator;

  @Autowired
  public ConnectionRegistry(
      IrcTransportFactory transports,
      IrcEventSink events,
      ChatLogWriter chatLog,
      IrcEngineProperties props,
      Clock clock,
      @Qualifier(ExecutorConfig.SESSION_EXECUTOR) ExecutorService sessionExecutor) {
    this(
        new SessionServices(
            transports, events, props.client().eventTopic(), chatLog, clock, sessionExecutor),
        sessionExecutor,
        () -> UUID.randomUUID().toString());
  }

  ConnectionRegistry(
      SessionServices services, ExecutorService sessionExecutor, Supplier<String> idGenerator) {
    this.services = Objects.requireNonNull(services, "services");
    this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  /**
   * Starts a session for {@code config} and returns its id without waiting for the handshake.
   *
   * <p>If a live session already exists for the same {@code server:port:nickname}, its id is
   * returned and nothing new is started.
   */
  public String connect(ConnectionConfig config) {
    Objects.requireNonNull(config, "config");
    ConnectionHandle handle;
    synchronized (lock) {
      Optional<ConnectionHandle> existing = findLiveLocked(config.storageKey());
      if (existing.isPresent()) {
        log.info("Reusing connection {} for {}", existing.get().id(), config.storageKey());
        return existing.get().id();
      }
      String id = nextIdLocked();
      handle = new ConnectionHandle(new IrcSession(id, config, services, this::reap));
      byId.put(id, handle);
    }

    try {
      sessionExecutor.execute(handle.session());
    } catch (RejectedExecutionException e) {
      synchronized (lock) {
        byId.remove(handle.id(), handle);
      }
      throw new IllegalStateException(
          "Engine is shutting down; cannot connect " + config.storageKey(), e);
    }
    log.info("Started connection {} for {}", handle.id(), config.storageKey());
    return handle.id();
  }

  /**
   * Detaches the connection, tells its session to quit and emits Disconnected right away.
   *
   * @throws ConnectionNotFoundException if the id is unknown
   */
  public void disconnect(String connectionId, String reason) {
    ConnectionCommand.Quit quit = new ConnectionCommand.Quit(reason);
    ConnectionHandle handle;
    synchronized (lock) {
      handle = byId.remove(normalize(connectionId));
    }
    if (handle == null) throw new ConnectionNotFoundException(connectionId);

    try {
      handle.send(quit);
    } catch (ConnectionClosedException e) {
      log.debug("Connection {} was already closing when disconnect was requested", handle.id());
    }
    handle.session().announceDisconnected(quit.reason());
    log.info("Disconnect requested for {} ({})", handle.id(), handle.storageKey());
  }

  public void join(String connectionId, String channel) {
    ConnectionHandle handle = require(connectionId);
    handle.send(new ConnectionCommand.Join(channel));
  }

  public void part(String connectionId, String channel, String reason) {
    ConnectionHandle handle = require(connectionId);
    handle.send(new ConnectionCommand.Part(channel, reason));
  }

  public void privmsg(String connectionId, String target, String message) {
    ConnectionHandle handle = require(connectionId);
    handle.send(new ConnectionCommand.Privmsg(target, message));
  }

  public void setTopic(String connectionId, String channel, String topic) {
    ConnectionHandle handle = require(connectionId);
    handle.send(new ConnectionCommand.Topic(channel, topic));
  }

  /** Ids of every registered connection. No particular order. */
  public Set<String> list() {
    synchronized (lock) {
      return Set.copyOf(byId.keySet());
    }
  }

  public Optional<ConnectionHandle> get(String connectionId) {
    synchronized (lock) {
      return Optional.ofNullable(byId.get(normalize(connectionId)));
    }
  }

  /** @throws ConnectionNotFoundException if the id is unknown or its session was reaped */
  public ConnectionHandle require(String connectionId) {
    return get(connectionId).orElseThrow(() -> new ConnectionNotFoundException(connectionId));
  }

  /** Live connection whose {@code server:port:nickname} matches {@code config}, if any. */
  public Optional<ConnectionHandle> findByConfig(ConnectionConfig config) {
    if (config == null) return Optional.empty();
    synchronized (lock) {
      return findLiveLocked(config.storageKey());
    }
  }

  /**
   * Disconnects every connection, then waits up to {@link #SHUTDOWN_GRACE} for their sessions to
   * write QUIT and close before the session executor is torn down.
   */
  @PreDestroy
  public void shutdown() {
    List<ConnectionHandle> handles;
    synchronized (lock) {
      handles = List.copyOf(byId.values());
    }
    for (ConnectionHandle handle : handles) {
      try {
        disconnect(handle.id(), SHUTDOWN_REASON);
      } catch (ConnectionNotFoundException e) {
        log.debug("Connection {} ended before shutdown reached it", handle.id());
      }
    }

    long deadline = System.nanoTime() + SHUTDOWN_GRACE.toNanos();
    for (ConnectionHandle handle : handles) {
      long remaining = deadline - System.nanoTime();
      try {
        if (remaining <= 0 || !handle.session().awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
          log.warn("Connection {} did not close within {}", handle.id(), SHUTDOWN_GRACE);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for connections to close");
        return;
      }
    }
  }

  private void reap(IrcSession session) {
    boolean removed;
    synchronized (lock) {
      ConnectionHandle current = byId.get(session.connectionId());
      removed = current != null && current.session() == session;
      if (removed) byId.remove(session.connectionId());
    }
    if (removed) {
      log.info("Reaped connection {} ({})", session.connectionId(), session.storageKey());
    }
  }

  private Optional<ConnectionHandle> findLiveLocked(String storageKey) {
    return byId.values().stream()
        .filter(h -> h.storageKey().equals(storageKey))
        .filter(ConnectionHandle::isLive)
        .findFirst();
  }

  private String nextIdLocked() {
    String id = idGenerator.get();
    while (byId.containsKey(id)) {
      id = idGenerator.get();
    }
    return id;
  }

  private static String normalize(String connectionId) {
    return Objects.toString(connectionId, "").trim();
  }
}
