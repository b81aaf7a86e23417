package cafe.woden.ircengine.connection;

import java.util.Objects;

/**
 * Outbound requests consumed by a session, exactly once and in send order.
 *
 * <p>Optional fields ({@code reason}, {@code topic}) are null when absent.
 */
public sealed interface ConnectionCommand
    permits ConnectionCommand.Join,
        ConnectionCommand.Part,
        ConnectionCommand.Privmsg,
        ConnectionCommand.Topic,
        ConnectionCommand.Quit {

  enum Type {
    JOIN,
    PART,
    PRIVMSG,
    TOPIC,
    QUIT
  }

  Type type();

  record Join(String channel) implements ConnectionCommand {
    public Join {
      channel = IrcArguments.requireToken(channel, "channel");
    }

    @Override
    public Type type() {
      return Type.JOIN;
    }
  }

  record Part(String channel, String reason) implements ConnectionCommand {
    public Part {
      channel = IrcArguments.requireToken(channel, "channel");
      reason = IrcArguments.optionalText(reason, "reason");
    }

    @Override
    public Type type() {
      return Type.PART;
    }
  }

  record Privmsg(String target, String message) implements ConnectionCommand {
    public Privmsg {
      target = IrcArguments.requireToken(target, "target");
      message = IrcArguments.requireText(Objects.toString(message, ""), "message");
    }

    @Override
    public Type type() {
      return Type.PRIVMSG;
    }
  }

  record Topic(String channel, String topic) implements ConnectionCommand {
    public Topic {
      channel = IrcArguments.requireToken(channel, "channel");
      topic = IrcArguments.optionalText(topic, "topic");
    }

    @Override
    public Type type() {
      return Type.TOPIC;
    }
  }

  record Quit(String reason) implements ConnectionCommand {
    public Quit {
      reason = IrcArguments.optionalText(reason, "reason");
    }

    @Override
    public Type type() {
      return Type.QUIT;
    }
  }
}
