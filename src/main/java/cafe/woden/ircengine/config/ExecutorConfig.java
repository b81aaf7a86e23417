package cafe.woden.ircengine.config;

import cafe.woden.ircengine.util.EngineThreads;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Kept workload-specific so a stalled disk can't delay socket work and vice versa.
 */
@Configuration
public class ExecutorConfig {
  public static final String SESSION_EXECUTOR = "ircSessionExecutor";
  public static final String SCROLLBACK_WRITER_EXECUTOR = "scrollbackWriterExecutor";

  /** Each live connection holds two threads from here: the session loop and its socket reader. */
  @Bean(name = SESSION_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService ircSessionExecutor() {
    return EngineThreads.newThreadPerTaskExecutor("ircengine-session");
  }

  @Bean(name = SCROLLBACK_WRITER_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService scrollbackWriterExecutor() {
    return EngineThreads.newSingleThreadExecutor("ircengine-scrollback");
  }

  @Bean
  public Clock engineClock() {
    return Clock.systemUTC();
  }
}
