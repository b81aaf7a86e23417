package cafe.woden.ircengine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class IrcEnginePropertiesBindingTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner().withUserConfiguration(IrcEnginePropertiesTestConfig.class);

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    runner.run(
        ctx -> {
          IrcEngineProperties props = ctx.getBean(IrcEngineProperties.class);
          assertEquals(IrcEngineProperties.DEFAULT_EVENT_TOPIC, props.client().eventTopic());
          assertTrue(props.client().tcpNoDelay());
          assertFalse(props.client().autoConnectSaved());
          assertFalse(props.client().tls().trustAllCertificates());
          assertEquals("scrollback", props.storage().scrollbackDirName());
          assertEquals("connections.json", props.storage().connectionsFileName());
          assertTrue(props.storage().dataDir().endsWith(".ircengine"));
        });
  }

  @Test
  void bindsKebabCaseOverrides() {
    runner
        .withPropertyValues(
            "ircengine.client.event-topic=irc://custom",
            "ircengine.client.tcp-no-delay=false",
            "ircengine.client.auto-connect-saved=true",
            "ircengine.client.tls.trust-all-certificates=true",
            "ircengine.storage.data-dir=/var/lib/ircengine",
            "ircengine.storage.scrollback-dir-name=logs",
            "ircengine.storage.connections-file-name=profiles.json")
        .run(
            ctx -> {
              IrcEngineProperties props = ctx.getBean(IrcEngineProperties.class);
              assertEquals("irc://custom", props.client().eventTopic());
              assertFalse(props.client().tcpNoDelay());
              assertTrue(props.client().autoConnectSaved());
              assertTrue(props.client().tls().trustAllCertificates());
              assertEquals(
                  Path.of("/var/lib/ircengine", "logs"), props.storage().scrollbackDir());
              assertEquals(
                  Path.of("/var/lib/ircengine", "profiles.json"),
                  props.storage().connectionsFile());
            });
  }

  @Test
  void blankValuesFallBackToDefaults() {
    runner
        .withPropertyValues(
            "ircengine.client.event-topic=  ", "ircengine.storage.scrollback-dir-name=")
        .run(
            ctx -> {
              IrcEngineProperties props = ctx.getBean(IrcEngineProperties.class);
              assertEquals(IrcEngineProperties.DEFAULT_EVENT_TOPIC, props.client().eventTopic());
              assertEquals("scrollback", props.storage().scrollbackDirName());
            });
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(IrcEngineProperties.class)
  static class IrcEnginePropertiesTestConfig {}
}
