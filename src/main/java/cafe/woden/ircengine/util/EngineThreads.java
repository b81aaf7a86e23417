package cafe.woden.ircengine.util;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared helpers for creating app-owned executors on named daemon threads.
 *
 * <p>Executors created here are tracked so {@link EngineThreadsLifecycle} can stop whatever is
 * still running when the context closes.
 */
public final class EngineThreads {
  private static final Logger log = LoggerFactory.getLogger(EngineThreads.class);

  private static final Set<ExecutorService> TRACKED_EXECUTORS = ConcurrentHashMap.newKeySet();

  private EngineThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicLong counter = new AtomicLong(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + counter.getAndIncrement());
      t.setDaemon(true);
      t.setUncaughtExceptionHandler(
          (thread, e) -> log.error("Uncaught exception on {}", thread.getName(), e));
      return t;
    };
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return track(Executors.newSingleThreadExecutor(namedFactory(baseName)));
  }

  /** One thread per task, reusing idle threads. Suits long-lived blocking work such as sessions. */
  public static ExecutorService newThreadPerTaskExecutor(String baseName) {
    return track(Executors.newCachedThreadPool(namedFactory(baseName)));
  }

  public static int shutdownTrackedExecutorsNow() {
    int count = 0;
    for (ExecutorService exec : List.copyOf(TRACKED_EXECUTORS)) {
      if (exec.isShutdown() || exec.isTerminated()) continue;
      exec.shutdownNow();
      count++;
    }
    TRACKED_EXECUTORS.clear();
    return count;
  }

  private static <E extends ExecutorService> E track(E exec) {
    TRACKED_EXECUTORS.removeIf(e -> e.isShutdown() || e.isTerminated());
    TRACKED_EXECUTORS.add(exec);
    return exec;
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "ircengine-thread" : s;
  }
}
