package cafe.woden.ircengine.connection;

import cafe.woden.ircengine.irc.IrcEventSink;
import cafe.woden.ircengine.logging.ChatLogWriter;
import cafe.woden.ircengine.net.IrcTransportFactory;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/** Collaborators shared by every session the registry starts. */
record SessionServices(
    IrcTransportFactory transports,
    IrcEventSink events,
    String eventTopic,
    ChatLogWriter chatLog,
    Clock clock,
    Executor readerExecutor) {

  SessionServices {
    Objects.requireNonNull(transports, "transports");
    Objects.requireNonNull(events, "events");
    Objects.requireNonNull(chatLog, "chatLog");
    Objects.requireNonNull(readerExecutor, "readerExecutor");
    if (eventTopic == null || eventTopic.isBlank()) eventTopic = IrcEventSink.DEFAULT_TOPIC;
    if (clock == null) clock = Clock.systemUTC();
  }
}
