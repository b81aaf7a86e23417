package cafe.woden.ircengine.connection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Everything needed to open one IRC session.
 *
 * <p>{@code username}, {@code realname} and {@code password} are optional (null when unset).
 * {@code autoJoin} is joined in order after the server's welcome. Every field that reaches the
 * wire is checked the same way outbound commands are, so a profile can't smuggle in extra lines.
 */
@ValueObject
public record ConnectionConfig(
    String server,
    int port,
    boolean useTls,
    String nickname,
    String username,
    String realname,
    String password,
    List<String> autoJoin) {

  /** Sort order used for saved profiles: server, then port, then nickname. */
  public static final Comparator<ConnectionConfig> PROFILE_ORDER =
      Comparator.comparing(ConnectionConfig::server)
          .thenComparingInt(ConnectionConfig::port)
          .thenComparing(ConnectionConfig::nickname);

  public ConnectionConfig {
    server = IrcArguments.requireToken(server, "server");
    nickname = IrcArguments.requireToken(nickname, "nickname");
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    username = blankToNull(username);
    if (username != null) username = IrcArguments.requireToken(username, "username");
    realname = IrcArguments.optionalText(blankToNull(realname), "realname");
    password = IrcArguments.optionalText(blankToNull(password), "password");
    if (autoJoin == null) {
      autoJoin = List.of();
    } else {
      List<String> channels = new ArrayList<>(autoJoin.size());
      for (String channel : autoJoin) channels.add(IrcArguments.requireToken(channel, "autoJoin"));
      autoJoin = List.copyOf(channels);
    }
  }

  /**
   * Identity of the session: {@code server:port:nickname}, compared exactly.
   *
   * <p>Used to dedupe connects and to partition scrollback on disk.
   */
  @JsonIgnore
  public String storageKey() {
    return server + ":" + port + ":" + nickname;
  }

  /** True when both configs would open the same session. */
  public boolean sameIdentity(ConnectionConfig other) {
    return other != null && storageKey().equals(other.storageKey());
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }
}
