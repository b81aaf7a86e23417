package cafe.woden.ircengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A single user-visible conversation record, as emitted to the UI and appended to scrollback.
 *
 * <p>{@code target} is the channel or, for direct messages, the other party's nick. {@code sender}
 * is null for server-originated lines such as topics. {@code metadata} is optional free-form JSON.
 */
@ValueObject
public record ChatMessage(
    @JsonProperty("connection_id") String connectionId,
    @JsonProperty("target") String target,
    @JsonProperty("sender") String sender,
    @JsonProperty("message") String message,
    @JsonProperty("kind") MessageKind kind,
    @JsonProperty("timestamp") long timestampMillis,
    @JsonProperty("metadata") @JsonInclude(JsonInclude.Include.NON_NULL) JsonNode metadata) {

  @JsonCreator
  public ChatMessage {
    Objects.requireNonNull(connectionId, "connectionId");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(kind, "kind");
    message = Objects.toString(message, "");
    if (metadata != null && metadata.isNull()) metadata = null;
  }

  public ChatMessage(
      String connectionId,
      String target,
      String sender,
      String message,
      MessageKind kind,
      long timestampMillis) {
    this(connectionId, target, sender, message, kind, timestampMillis, null);
  }
}
