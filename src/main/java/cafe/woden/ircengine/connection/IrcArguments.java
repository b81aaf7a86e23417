package cafe.woden.ircengine.connection;

import java.util.Objects;

/** Argument checks for outbound commands; anything that could inject a second line is rejected. */
final class IrcArguments {

  private IrcArguments() {}

  /** Nick, channel or other single-word argument. */
  static String requireToken(String value, String what) {
    String v = Objects.requireNonNull(value, what).trim();
    if (v.isEmpty()) throw new IllegalArgumentException(what + " is blank");
    if (v.contains("\r") || v.contains("\n")) {
      throw new IllegalArgumentException(what + " contains CR/LF");
    }
    if (v.contains(" ")) throw new IllegalArgumentException(what + " contains spaces");
    return v;
  }

  /** Free text that ends up in a trailing parameter. */
  static String requireText(String value, String what) {
    Objects.requireNonNull(value, what);
    if (value.contains("\r") || value.contains("\n")) {
      throw new IllegalArgumentException(what + " contains CR/LF");
    }
    return value;
  }

  static String optionalText(String value, String what) {
    return value == null ? null : requireText(value, what);
  }
}
