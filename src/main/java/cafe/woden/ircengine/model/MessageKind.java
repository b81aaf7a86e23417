package cafe.woden.ircengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What a {@link ChatMessage} represents. Serialized in snake_case. */
public enum MessageKind {
  PRIVMSG,
  ACTION,
  NOTICE,
  JOIN,
  PART,
  QUIT,
  NICK,
  TOPIC,
  INFO,
  ERROR;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static MessageKind fromWireName(String value) {
    if (value == null) return null;
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
