package cafe.woden.ircengine.logging;

import cafe.woden.ircengine.model.ChatMessage;

/**
 * Fire-and-forget sink for scrollback records.
 *
 * <p>Implementations must not block the calling session and must not throw; failures are theirs to
 * log.
 */
@FunctionalInterface
public interface ChatLogWriter {
  void log(String storageKey, ChatMessage message);
}
