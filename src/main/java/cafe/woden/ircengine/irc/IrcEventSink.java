package cafe.woden.ircengine.irc;

/**
 * Where sessions publish their events.
 *
 * <p>Implementations accept one event at a time and must never block the caller. Delivery is
 * best-effort; callers do not observe failures.
 */
@FunctionalInterface
public interface IrcEventSink {

  String DEFAULT_TOPIC = "irc://event";

  void emit(String topic, IrcEvent event);
}
