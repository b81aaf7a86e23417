package cafe.woden.ircengine.config;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class ExecutorConfigTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner().withUserConfiguration(ExecutorConfig.class);

  @Test
  void exposesDistinctExecutorsAndAClock() {
    runner.run(
        ctx -> {
          ExecutorService sessions =
              ctx.getBean(ExecutorConfig.SESSION_EXECUTOR, ExecutorService.class);
          ExecutorService scrollback =
              ctx.getBean(ExecutorConfig.SCROLLBACK_WRITER_EXECUTOR, ExecutorService.class);
          assertNotSame(sessions, scrollback);
          assertInstanceOf(Clock.class, ctx.getBean(Clock.class));
        });
  }

  @Test
  void contextCloseShutsDownExecutors() {
    AtomicReference<ExecutorService> sessionsRef = new AtomicReference<>();
    AtomicReference<ExecutorService> scrollbackRef = new AtomicReference<>();

    runner.run(
        ctx -> {
          sessionsRef.set(ctx.getBean(ExecutorConfig.SESSION_EXECUTOR, ExecutorService.class));
          scrollbackRef.set(
              ctx.getBean(ExecutorConfig.SCROLLBACK_WRITER_EXECUTOR, ExecutorService.class));
        });

    assertTrue(sessionsRef.get().isShutdown());
    assertTrue(scrollbackRef.get().isShutdown());
  }
}
