package cafe.woden.ircengine.irc;

/**
 * Canonical outbound line forms. Line terminators are added by the writer, not here.
 *
 * <p>Optional arguments are treated as absent when null.
 */
public final class IrcWireCommands {

  private IrcWireCommands() {}

  public static String pass(String password) {
    return "PASS " + password;
  }

  public static String nick(String nickname) {
    return "NICK " + nickname;
  }

  /** {@code USER <username> 0 * :<realname>}; both fall back to the nickname. */
  public static String user(String username, String realname, String nickname) {
    String u = username == null ? nickname : username;
    String r = realname == null ? nickname : realname;
    return "USER " + u + " 0 * :" + r;
  }

  public static String join(String channel) {
    return "JOIN " + channel;
  }

  public static String part(String channel, String reason) {
    if (reason == null) return "PART " + channel;
    return "PART " + channel + " :" + reason;
  }

  public static String privmsg(String target, String message) {
    return "PRIVMSG " + target + " :" + message;
  }

  public static String topic(String channel, String topic) {
    if (topic == null) return "TOPIC " + channel;
    return "TOPIC " + channel + " :" + topic;
  }

  public static String quit(String reason) {
    if (reason == null) return "QUIT";
    return "QUIT :" + reason;
  }

  public static String pong(String token) {
    return "PONG :" + token;
  }

  /** Log-safe rendering of an outbound line; hides PASS arguments. */
  public static String redact(String line) {
    if (line != null && line.regionMatches(true, 0, "PASS ", 0, 5)) return "PASS ****";
    return line;
  }
}
