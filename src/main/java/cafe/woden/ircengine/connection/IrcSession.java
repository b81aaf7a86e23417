package cafe.woden.ircengine.connection;

import cafe.woden.ircengine.irc.ChannelUser;
import cafe.woden.ircengine.irc.IrcEvent;
import cafe.woden.ircengine.irc.IrcLine;
import cafe.woden.ircengine.irc.IrcLineCodec;
import cafe.woden.ircengine.irc.IrcWireCommands;
import cafe.woden.ircengine.model.ChatMessage;
import cafe.woden.ircengine.model.MessageKind;
import cafe.woden.ircengine.net.IrcTransport;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One IRC connection: connect, register, then serve inbound lines and outbound commands until the
 * session closes.
 *
 * <p>{@link #run()} is the session thread. It is the only code that writes to the socket. A
 * second thread does nothing but read lines and queue them; commands from callers land on the same
 * queue, so the session loop handles one thing at a time in arrival order per source.
 *
 * <p>Exactly one {@link IrcEvent.Disconnected} is emitted per session that reached READY,
 * whichever of quit, EOF, read error or registry disconnect gets there first. Once it is out, no
 * {@link IrcEvent.Connected} follows it, even if the socket only finishes opening afterwards.
 */
final class IrcSession implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(IrcSession.class);

  static final String REASON_CONNECTION_CLOSED = "connection closed";

  private sealed interface Signal permits InboundLine, InboundEnded, Outbound {}

  private record InboundLine(String line) implements Signal {}

  /** {@code error} is null on clean EOF. */
  private record InboundEnded(IOException error) implements Signal {}

  private record Outbound(ConnectionCommand command) implements Signal {}

  private final String connectionId;
  private final ConnectionConfig config;
  private final String storageKey;
  private final SessionServices services;
  private final Consumer<IrcSession> onTerminated;

  private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
  private final AtomicBoolean acceptingCommands = new AtomicBoolean(true);
  private final AtomicBoolean disconnectAnnounced = new AtomicBoolean(false);
  private final Object lifecycleEvents = new Object();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final AtomicReference<IrcTransport> transportRef = new AtomicReference<>();
  private volatile SessionState state = SessionState.CONNECTING;

  // Session thread only.
  private long lastTimestampMs = Long.MIN_VALUE;

  IrcSession(
      String connectionId,
      ConnectionConfig config,
      SessionServices services,
      Consumer<IrcSession> onTerminated) {
    this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    this.config = Objects.requireNonNull(config, "config");
    this.storageKey = config.storageKey();
    this.services = Objects.requireNonNull(services, "services");
    this.onTerminated = onTerminated == null ? s -> {} : onTerminated;
  }

  String connectionId() {
    return connectionId;
  }

  String storageKey() {
    return storageKey;
  }

  ConnectionConfig config() {
    return config;
  }

  SessionState state() {
    return state;
  }

  boolean acceptingCommands() {
    return acceptingCommands.get();
  }

  /**
   * Queues a command for the session thread. Never blocks.
   *
   * @throws ConnectionClosedException if the session has already started closing
   */
  void submit(ConnectionCommand command) {
    Objects.requireNonNull(command, "command");
    if (!acceptingCommands.get()) throw new ConnectionClosedException(connectionId);
    signals.add(new Outbound(command));
  }

  /**
   * Emits the session's single Disconnected event if nobody has yet.
   *
   * <p>Safe from any thread; the registry calls this so the UI updates without waiting on the
   * session thread.
   */
  void announceDisconnected(String reason) {
    synchronized (lifecycleEvents) {
      if (disconnectAnnounced.compareAndSet(false, true)) {
        emit(new IrcEvent.Disconnected(connectionId, reason));
      }
    }
  }

  /** @return false, without emitting, when Disconnected is already out */
  private boolean announceConnected(String detail) {
    synchronized (lifecycleEvents) {
      if (disconnectAnnounced.get()) return false;
      emit(new IrcEvent.Connected(connectionId, config.nickname(), config.server(), detail));
      return true;
    }
  }

  /** Waits for {@link #run()} to finish, including the termination callback. */
  boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return terminated.await(timeout, unit);
  }

  @Override
  public void run() {
    boolean reachedReady = false;
    try {
      IrcTransport transport = open();
      if (transport == null) return;
      if (!register(transport)) return;
      reachedReady = true;
      startReader(transport);
      serve();
    } finally {
      acceptingCommands.set(false);
      if (reachedReady) {
        // Covers exits the loop doesn't announce itself, such as an interrupted session thread.
        announceDisconnected(REASON_CONNECTION_CLOSED);
      }
      state = SessionState.CLOSED;
      closeTransport();
      log.info("[{}] session closed ({})", connectionId, storageKey);
      try {
        onTerminated.accept(this);
      } catch (RuntimeException e) {
        log.warn("[{}] termination callback failed", connectionId, e);
      }
      terminated.countDown();
    }
  }

  private IrcTransport open() {
    log.info(
        "[{}] connecting to {}:{} (tls={})",
        connectionId,
        config.server(),
        config.port(),
        config.useTls());
    try {
      IrcTransport transport =
          services.transports().open(config.server(), config.port(), config.useTls());
      transportRef.set(transport);
      state = SessionState.HANDSHAKING;
      return transport;
    } catch (IOException | RuntimeException e) {
      log.warn(
          "[{}] failed to connect to {}:{}: {}",
          connectionId,
          config.server(),
          config.port(),
          describe(e));
      emit(new IrcEvent.Error(connectionId, "failed to connect: " + describe(e)));
      return null;
    }
  }

  private boolean register(IrcTransport transport) {
    try {
      if (config.password() != null) {
        write(transport, IrcWireCommands.pass(config.password()));
      }
      write(transport, IrcWireCommands.nick(config.nickname()));
      write(
          transport,
          IrcWireCommands.user(config.username(), config.realname(), config.nickname()));
    } catch (IOException e) {
      log.warn("[{}] handshake failed: {}", connectionId, describe(e));
      emit(new IrcEvent.Error(connectionId, "handshake failed: " + describe(e)));
      return false;
    }

    state = SessionState.READY;
    log.info(
        "[{}] registered as {} on {}:{}",
        connectionId,
        config.nickname(),
        config.server(),
        config.port());
    if (!announceConnected("connected")) {
      // Disconnected while still connecting; the queued Quit is served next.
      log.debug("[{}] disconnect arrived during connect; not announcing Connected", connectionId);
    }
    return true;
  }

  private void startReader(IrcTransport transport) {
    try {
      services.readerExecutor().execute(() -> readLoop(transport));
    } catch (RejectedExecutionException e) {
      signals.add(new InboundEnded(new IOException("reader could not be started", e)));
    }
  }

  private void readLoop(IrcTransport transport) {
    try {
      String line;
      while ((line = transport.readLine()) != null) {
        signals.add(new InboundLine(line));
      }
      signals.add(new InboundEnded(null));
    } catch (IOException e) {
      if (state.compareTo(SessionState.CLOSING) >= 0) {
        // We closed the socket ourselves; the session already announced why.
        log.debug("[{}] reader stopped after close: {}", connectionId, describe(e));
      } else {
        signals.add(new InboundEnded(e));
      }
    }
  }

  private void serve() {
    try {
      while (true) {
        Signal signal = signals.take();
        if (handle(signal)) return;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      state = SessionState.CLOSING;
      log.debug("[{}] session thread interrupted", connectionId);
    }
  }

  /** @return true when the session should stop */
  private boolean handle(Signal signal) {
    if (signal instanceof InboundLine in) {
      try {
        handleInbound(in.line());
      } catch (RuntimeException e) {
        log.warn("[{}] failed to handle line: {}", connectionId, in.line(), e);
      }
      return false;
    }
    if (signal instanceof Outbound out) {
      return handleCommand(out.command());
    }
    if (signal instanceof InboundEnded ended) {
      beginClosing();
      String reason;
      if (ended.error() == null) {
        log.info("[{}] connection closed by server", connectionId);
        reason = REASON_CONNECTION_CLOSED;
      } else {
        log.warn("[{}] read error: {}", connectionId, describe(ended.error()));
        reason = "read error: " + describe(ended.error());
      }
      announceDisconnected(reason);
      return true;
    }
    return false;
  }

  void handleInbound(String raw) {
    IrcLine line = IrcLineCodec.parse(raw);
    switch (line.command()) {
      case "PING" -> onPing(line);
      case "001" -> onWelcome();
      case "353" -> onNamesReply(line);
      case "332" -> onTopicReply(line);
      case "PRIVMSG" -> onPrivmsg(line);
      case "NOTICE" -> onNotice(line);
      case "JOIN" -> onJoin(line);
      case "PART" -> onPart(line);
      case "QUIT" -> onQuit(line);
      case "433" -> emit(new IrcEvent.Error(connectionId, "nickname already in use"));
      default -> log.trace("[{}] ignoring {}", connectionId, line.command());
    }
  }

  /** @return true when the session should stop */
  boolean handleCommand(ConnectionCommand command) {
    return switch (command.type()) {
      case JOIN -> {
        ConnectionCommand.Join join = (ConnectionCommand.Join) command;
        send(IrcWireCommands.join(join.channel()));
        yield false;
      }
      case PART -> {
        ConnectionCommand.Part part = (ConnectionCommand.Part) command;
        send(IrcWireCommands.part(part.channel(), part.reason()));
        yield false;
      }
      case PRIVMSG -> {
        ConnectionCommand.Privmsg msg = (ConnectionCommand.Privmsg) command;
        send(IrcWireCommands.privmsg(msg.target(), msg.message()));
        // Servers don't echo our own PRIVMSG back, so record it locally.
        record(
            new ChatMessage(
                connectionId,
                msg.target(),
                config.nickname(),
                msg.message(),
                MessageKind.PRIVMSG,
                nextTimestamp()));
        yield false;
      }
      case TOPIC -> {
        ConnectionCommand.Topic topic = (ConnectionCommand.Topic) command;
        send(IrcWireCommands.topic(topic.channel(), topic.topic()));
        yield false;
      }
      case QUIT -> {
        quit((ConnectionCommand.Quit) command);
        yield true;
      }
    };
  }

  private void quit(ConnectionCommand.Quit quit) {
    beginClosing();
    IrcTransport transport = transportRef.get();
    if (transport != null) {
      try {
        write(transport, IrcWireCommands.quit(quit.reason()));
      } catch (IOException e) {
        log.debug("[{}] QUIT not delivered: {}", connectionId, describe(e));
      }
    }
    log.info("[{}] quit requested", connectionId);
    announceDisconnected(quit.reason());
  }

  private void onPing(IrcLine line) {
    Optional<String> token = line.param(0).or(line::trailingText);
    token.ifPresent(t -> send(IrcWireCommands.pong(t)));
  }

  private void onWelcome() {
    if (!announceConnected("welcome")) return;
    for (String channel : config.autoJoin()) {
      send(IrcWireCommands.join(channel));
    }
  }

  private void onNamesReply(IrcLine line) {
    // :server 353 me = #chan :@alice +bob carol
    Optional<String> channel = line.param(2);
    if (channel.isEmpty()) return;
    List<ChannelUser> users = IrcLineCodec.parseNamesList(line.trailing());
    emit(new IrcEvent.Names(connectionId, channel.get(), users));
  }

  private void onTopicReply(IrcLine line) {
    // :server 332 me #chan :topic text
    Optional<String> channel = line.param(1);
    if (channel.isEmpty()) return;
    String topic = line.trailingText().orElse("");
    emit(new IrcEvent.Topic(connectionId, channel.get(), topic, null));
    record(
        new ChatMessage(
            connectionId,
            channel.get(),
            null,
            "Topic: " + topic,
            MessageKind.TOPIC,
            nextTimestamp()));
  }

  private void onPrivmsg(IrcLine line) {
    Optional<String> rawTarget = line.param(0);
    if (rawTarget.isEmpty()) return;
    String text = messageText(line);
    Optional<String> action = IrcLineCodec.parseCtcpAction(text);
    MessageKind kind = action.isPresent() ? MessageKind.ACTION : MessageKind.PRIVMSG;
    String sender = line.sourceNick().orElse(null);

    String target = rawTarget.get();
    if (sender != null && target.equalsIgnoreCase(config.nickname())) {
      // Direct message to us: file it under the other party.
      target = sender;
    }
    record(
        new ChatMessage(connectionId, target, sender, action.orElse(text), kind, nextTimestamp()));
  }

  private void onNotice(IrcLine line) {
    Optional<String> target = line.param(0);
    if (target.isEmpty()) return;
    record(
        new ChatMessage(
            connectionId,
            target.get(),
            line.sourceNick().orElse(null),
            messageText(line),
            MessageKind.NOTICE,
            nextTimestamp()));
  }

  private void onJoin(IrcLine line) {
    String channel = line.param(0).or(line::trailingText).orElse("");
    String nick = actorNick(line);
    record(
        new ChatMessage(
            connectionId,
            channel,
            nick,
            nick + " joined " + channel,
            MessageKind.JOIN,
            nextTimestamp()));
  }

  private void onPart(IrcLine line) {
    Optional<String> channel = line.param(0);
    if (channel.isEmpty()) return;
    String nick = actorNick(line);
    String reason = line.param(1).or(line::trailingText).orElse("");
    String text = nick + " left " + channel.get();
    if (!reason.isEmpty()) text += " (" + reason + ")";
    record(
        new ChatMessage(
            connectionId, channel.get(), nick, text, MessageKind.PART, nextTimestamp()));
  }

  private void onQuit(IrcLine line) {
    String nick = actorNick(line);
    String reason = line.param(0).or(line::trailingText).orElse("");
    String text = reason.isEmpty() ? nick + " quit" : nick + " quit: " + reason;
    record(new ChatMessage(connectionId, nick, nick, text, MessageKind.QUIT, nextTimestamp()));
  }

  private String actorNick(IrcLine line) {
    return line.sourceNick().orElse(config.nickname());
  }

  private static String messageText(IrcLine line) {
    return line.trailingText().or(() -> line.param(1)).orElse("");
  }

  private void record(ChatMessage message) {
    try {
      services.chatLog().log(storageKey, message);
    } catch (RuntimeException e) {
      log.warn("[{}] scrollback append failed for {}", connectionId, message.target(), e);
    }
    emit(new IrcEvent.Message(message));
  }

  /** Wall clock, clamped so timestamps never go backwards within this session. */
  private long nextTimestamp() {
    long now = services.clock().millis();
    if (now < lastTimestampMs) now = lastTimestampMs;
    lastTimestampMs = now;
    return now;
  }

  /** Steady-state write: failures are logged and otherwise ignored. */
  private void send(String line) {
    IrcTransport transport = transportRef.get();
    if (transport == null) return;
    try {
      write(transport, line);
    } catch (IOException e) {
      log.debug(
          "[{}] write failed for '{}': {}",
          connectionId,
          IrcWireCommands.redact(line),
          describe(e));
    }
  }

  private void write(IrcTransport transport, String line) throws IOException {
    if (log.isDebugEnabled()) {
      log.debug("[{}] >> {}", connectionId, IrcWireCommands.redact(line));
    }
    transport.writeLine(line);
  }

  private void emit(IrcEvent event) {
    try {
      services.events().emit(services.eventTopic(), event);
    } catch (RuntimeException e) {
      log.debug("[{}] event sink rejected {}", connectionId, event.type(), e);
    }
  }

  private void beginClosing() {
    acceptingCommands.set(false);
    state = SessionState.CLOSING;
  }

  private void closeTransport() {
    IrcTransport transport = transportRef.get();
    if (transport == null) return;
    try {
      transport.close();
    } catch (IOException e) {
      log.debug("[{}] error closing transport: {}", connectionId, describe(e));
    }
  }

  private static String describe(Throwable e) {
    String msg = e.getMessage();
    return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
  }
}
