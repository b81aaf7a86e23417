package cafe.woden.ircengine.app;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import cafe.woden.ircengine.config.IrcEngineProperties;
import cafe.woden.ircengine.config.SavedConnectionStore;
import cafe.woden.ircengine.connection.ConnectionConfig;
import cafe.woden.ircengine.connection.ConnectionRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class SavedConnectionsAutoConnectorTest {

  private final SavedConnectionStore saved = mock(SavedConnectionStore.class);
  private final ConnectionRegistry registry = mock(ConnectionRegistry.class);

  @Test
  void doesNothingWhenDisabled() {
    new SavedConnectionsAutoConnector(props(false), saved, registry)
        .run(new DefaultApplicationArguments());

    verifyNoInteractions(saved, registry);
  }

  @Test
  void connectsEverySavedProfileAndKeepsGoingAfterFailures() {
    ConnectionConfig a = new ConnectionConfig("a", 6667, false, "x", null, null, null, null);
    ConnectionConfig b = new ConnectionConfig("b", 6667, false, "x", null, null, null, null);
    when(saved.list()).thenReturn(List.of(a, b));
    when(registry.connect(a)).thenThrow(new IllegalStateException("Engine is shutting down"));

    new SavedConnectionsAutoConnector(props(true), saved, registry)
        .run(new DefaultApplicationArguments());

    verify(registry).connect(a);
    verify(registry).connect(b);
  }

  private static IrcEngineProperties props(boolean autoConnect) {
    return new IrcEngineProperties(
        new IrcEngineProperties.Client(null, null, autoConnect, null), null);
  }
}
