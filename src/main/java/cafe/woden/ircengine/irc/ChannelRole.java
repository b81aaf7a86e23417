package cafe.woden.ircengine.irc;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/** Channel privilege carried by a NAMES sigil. */
public enum ChannelRole {
  OWNER('~', "owner"),
  ADMIN('&', "admin"),
  OP('@', "op"),
  HALFOP('%', "halfop"),
  VOICE('+', "voice");

  private final char sigil;
  private final String tag;

  ChannelRole(char sigil, String tag) {
    this.sigil = sigil;
    this.tag = tag;
  }

  public char sigil() {
    return sigil;
  }

  @JsonValue
  public String tag() {
    return tag;
  }

  public static Optional<ChannelRole> fromSigil(char c) {
    for (ChannelRole role : values()) {
      if (role.sigil == c) return Optional.of(role);
    }
    return Optional.empty();
  }
}
