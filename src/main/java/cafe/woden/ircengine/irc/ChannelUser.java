package cafe.woden.ircengine.irc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Channel roster entry decoded from a NAMES reply. Roles keep sigil order.
 *
 * <p>Serializes as {@code {"nick": ..., "modes": [...]}}.
 */
@ValueObject
@JsonPropertyOrder({"nick", "modes"})
public record ChannelUser(String nick, @JsonIgnore List<ChannelRole> roles) {

  public ChannelUser {
    nick = Objects.toString(nick, "");
    roles = roles == null ? List.of() : List.copyOf(roles);
  }

  /** Role tags ("op", "voice", ...) in sigil order. */
  @JsonProperty("modes")
  public List<String> modes() {
    return roles.stream().map(ChannelRole::tag).toList();
  }
}
