package cafe.woden.ircengine.irc;

import java.util.List;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One inbound IRC line split into its parts.
 *
 * <p>{@code prefix} is the text between the leading ':' and the first space, {@code trailing} is
 * everything after the first {@code " :"} token. Either may be null.
 */
@ValueObject
public record IrcLine(String prefix, String command, List<String> params, String trailing) {

  public IrcLine {
    if (command == null) command = "";
    params = params == null ? List.of() : List.copyOf(params);
  }

  /** Parameter at {@code index}, if present. */
  public Optional<String> param(int index) {
    if (index < 0 || index >= params.size()) return Optional.empty();
    return Optional.of(params.get(index));
  }

  public Optional<String> trailingText() {
    return Optional.ofNullable(trailing);
  }

  /** Nick portion of the prefix ({@code nick!user@host}), if any. */
  public Optional<String> sourceNick() {
    return IrcLineCodec.nickFromPrefix(prefix);
  }
}
