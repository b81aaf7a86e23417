package cafe.woden.ircengine.irc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lenient parsing helpers for inbound server lines.
 *
 * <p>Nothing in here throws on bad input. Servers vary in strictness, so a malformed line degrades
 * to empty fields and the caller simply finds no command it recognizes.
 */
public final class IrcLineCodec {

  static final char CTCP_DELIMITER = '\u0001';
  private static final String CTCP_ACTION_PREFIX = "ACTION ";

  private IrcLineCodec() {}

  public static IrcLine parse(String raw) {
    String rest = raw == null ? "" : raw.trim();
    String prefix = null;

    if (rest.startsWith(":")) {
      int sp = rest.indexOf(' ');
      if (sp < 0) {
        // ":something" with nothing after it; keep it as the command rather than failing.
        return new IrcLine(null, rest, List.of(), null);
      }
      prefix = rest.substring(1, sp);
      rest = rest.substring(sp + 1);
    }

    String trailing = null;
    String head = rest;
    int idx = rest.indexOf(" :");
    if (idx >= 0) {
      head = rest.substring(0, idx);
      trailing = rest.substring(idx + 2);
    }

    String[] tokens = head.trim().isEmpty() ? new String[0] : head.trim().split("\\s+");
    String command = tokens.length > 0 ? tokens[0] : "";
    List<String> params = new ArrayList<>();
    for (int i = 1; i < tokens.length; i++) {
      params.add(tokens[i]);
    }
    return new IrcLine(prefix, command, params, trailing);
  }

  /** {@code nick!user@host} to {@code nick}. Empty when there is no prefix or no nick in it. */
  public static Optional<String> nickFromPrefix(String prefix) {
    if (prefix == null) return Optional.empty();
    int bang = prefix.indexOf('!');
    String nick = bang >= 0 ? prefix.substring(0, bang) : prefix;
    return nick.isEmpty() ? Optional.empty() : Optional.of(nick);
  }

  /**
   * Decodes one RPL_NAMREPLY entry such as {@code "@+alice"}.
   *
   * <p>Sigils are collected in the order they appear. The first character that is not a known
   * sigil starts the nick.
   */
  public static ChannelUser parseNamesEntry(String entry) {
    String s = entry == null ? "" : entry;
    List<ChannelRole> roles = new ArrayList<>();
    int i = 0;
    while (i < s.length()) {
      Optional<ChannelRole> role = ChannelRole.fromSigil(s.charAt(i));
      if (role.isEmpty()) break;
      roles.add(role.get());
      i++;
    }
    return new ChannelUser(s.substring(i), roles);
  }

  /** Splits a RPL_NAMREPLY trailing list into decoded entries. */
  public static List<ChannelUser> parseNamesList(String trailing) {
    if (trailing == null || trailing.isBlank()) return List.of();
    List<ChannelUser> out = new ArrayList<>();
    for (String entry : trailing.trim().split("\\s+")) {
      out.add(parseNamesEntry(entry));
    }
    return List.copyOf(out);
  }

  /**
   * Returns the CTCP ACTION body, or empty if {@code message} isn't a CTCP ACTION.
   *
   * <p>Any run of 0x01 delimiters on either end is stripped before looking for {@code "ACTION "}.
   */
  public static Optional<String> parseCtcpAction(String message) {
    if (!isCtcpWrapped(message)) return Optional.empty();
    int start = 0;
    int end = message.length();
    while (start < end && message.charAt(start) == CTCP_DELIMITER) start++;
    while (end > start && message.charAt(end - 1) == CTCP_DELIMITER) end--;
    String body = message.substring(start, end);
    if (!body.startsWith(CTCP_ACTION_PREFIX)) return Optional.empty();
    return Optional.of(body.substring(CTCP_ACTION_PREFIX.length()));
  }

  static boolean isCtcpWrapped(String message) {
    if (message == null || message.isEmpty()) return false;
    return message.charAt(0) == CTCP_DELIMITER
        && message.charAt(message.length() - 1) == CTCP_DELIMITER;
  }
}
