package cafe.woden.ircengine.irc;

import cafe.woden.ircengine.model.ChatMessage;
import java.util.List;
import java.util.Objects;

/**
 * Normalized events surfaced to the UI layer.
 *
 * <p>Every variant carries the connection id it belongs to and a {@link Type} tag. Consumers
 * dispatch by switching over {@link #type()}; switch expressions over the enum keep that dispatch
 * exhaustive.
 */
public sealed interface IrcEvent
    permits IrcEvent.Connected,
        IrcEvent.Disconnected,
        IrcEvent.Message,
        IrcEvent.Names,
        IrcEvent.Topic,
        IrcEvent.Error {

  enum Type {
    CONNECTED,
    DISCONNECTED,
    MESSAGE,
    NAMES,
    TOPIC,
    ERROR
  }

  String connectionId();

  Type type();

  /** Emitted once the registration lines are written, and again on the 001 welcome. */
  record Connected(String connectionId, String nickname, String server, String message)
      implements IrcEvent {
    @Override
    public Type type() {
      return Type.CONNECTED;
    }
  }

  /** {@code reason} may be null when the user quit without one. */
  record Disconnected(String connectionId, String reason) implements IrcEvent {
    @Override
    public Type type() {
      return Type.DISCONNECTED;
    }
  }

  record Message(ChatMessage data) implements IrcEvent {
    public Message {
      Objects.requireNonNull(data, "data");
    }

    @Override
    public String connectionId() {
      return data.connectionId();
    }

    @Override
    public Type type() {
      return Type.MESSAGE;
    }
  }

  /** One RPL_NAMREPLY batch; large channels arrive as several of these. */
  record Names(String connectionId, String channel, List<ChannelUser> users) implements IrcEvent {
    public Names {
      users = users == null ? List.of() : List.copyOf(users);
    }

    @Override
    public Type type() {
      return Type.NAMES;
    }
  }

  /** {@code setter} is null when the server didn't say who set it. */
  record Topic(String connectionId, String channel, String topic, String setter)
      implements IrcEvent {
    @Override
    public Type type() {
      return Type.TOPIC;
    }
  }

  record Error(String connectionId, String message) implements IrcEvent {
    @Override
    public Type type() {
      return Type.ERROR;
    }
  }
}
