package cafe.woden.ircengine.logging;

import cafe.woden.ircengine.model.ChatMessage;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChatLogWriter} that appends to a {@link ScrollbackStore} on a single background thread.
 *
 * <p>The single thread keeps appends in submission order. Failures are logged and dropped; they
 * never reach the session that produced the message.
 */
public class AsyncChatLogWriter implements ChatLogWriter {

  private static final Logger log = LoggerFactory.getLogger(AsyncChatLogWriter.class);

  private final ScrollbackStore store;
  private final ExecutorService exec;

  public AsyncChatLogWriter(ScrollbackStore store, ExecutorService singleThreadExecutor) {
    this.store = Objects.requireNonNull(store, "store");
    this.exec = Objects.requireNonNull(singleThreadExecutor, "singleThreadExecutor");
  }

  @Override
  public void log(String storageKey, ChatMessage message) {
    if (storageKey == null || message == null) return;
    try {
      exec.execute(() -> append(storageKey, message));
    } catch (RejectedExecutionException e) {
      log.warn("Scrollback writer is shut down; dropping message for {}", message.target());
    }
  }

  private void append(String storageKey, ChatMessage message) {
    try {
      store.append(storageKey, message);
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to append scrollback for {} / {}", storageKey, message.target(), e);
    }
  }
}
