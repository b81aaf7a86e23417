package cafe.woden.ircengine.logging;

import cafe.woden.ircengine.model.ChatMessage;
import java.io.IOException;
import java.util.List;

/** Durable per-(connection identity, target) message history. */
public interface ScrollbackStore {

  void append(String storageKey, ChatMessage message) throws IOException;

  /** Whole history for {@code target}, oldest first. Empty when nothing was ever written. */
  List<ChatMessage> readAll(String storageKey, String target) throws IOException;

  /** The most recent {@code limit} entries, oldest first. */
  default List<ChatMessage> readLast(String storageKey, String target, int limit)
      throws IOException {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
    List<ChatMessage> all = readAll(storageKey, target);
    if (all.size() <= limit) return all;
    return List.copyOf(all.subList(all.size() - limit, all.size()));
  }
}
