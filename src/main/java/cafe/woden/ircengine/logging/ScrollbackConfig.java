package cafe.woden.ircengine.logging;

import cafe.woden.ircengine.config.ExecutorConfig;
import cafe.woden.ircengine.config.IrcEngineProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the on-disk scrollback store and the asynchronous writer sessions use. */
@Configuration
public class ScrollbackConfig {

  @Bean
  public ScrollbackStore scrollbackStore(IrcEngineProperties props) throws IOException {
    return new JsonlScrollbackStore(props.storage().scrollbackDir(), new ObjectMapper());
  }

  @Bean
  public ChatLogWriter chatLogWriter(
      ScrollbackStore store,
      @Qualifier(ExecutorConfig.SCROLLBACK_WRITER_EXECUTOR) ExecutorService exec) {
    return new AsyncChatLogWriter(store, exec);
  }
}
