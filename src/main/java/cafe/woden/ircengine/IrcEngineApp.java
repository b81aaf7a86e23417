package cafe.woden.ircengine;

import cafe.woden.ircengine.config.IrcEngineProperties;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(IrcEngineProperties.class)
public class IrcEngineApp {

  public static void main(String[] args) {
    new SpringApplicationBuilder(IrcEngineApp.class)
        .web(WebApplicationType.NONE)
        .headless(true)
        .run(args);
  }
}
