package cafe.woden.ircengine.connection;

/** Lifecycle of one {@link IrcSession}. Transitions only move forward. */
public enum SessionState {
  CONNECTING,
  HANDSHAKING,
  READY,
  CLOSING,
  CLOSED
}
