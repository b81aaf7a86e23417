package cafe.woden.ircengine.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectionConfigTest {

  @Test
  void blankOptionalFieldsBecomeNull() {
    ConnectionConfig cfg = new ConnectionConfig("irc.test", 6667, false, "alice", " ", "", null, null);

    assertNull(cfg.username());
    assertNull(cfg.realname());
    assertNull(cfg.password());
    assertEquals(List.of(), cfg.autoJoin());
  }

  @Test
  void rejectsPortsOutOfRange() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ConnectionConfig("irc.test", 0, false, "alice", null, null, null, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ConnectionConfig("irc.test", 65536, false, "alice", null, null, null, null));
  }

  @Test
  void identityIsServerPortNicknameOnly() {
    ConnectionConfig a = new ConnectionConfig("irc.test", 6697, true, "alice", null, null, "pw", null);
    ConnectionConfig b =
        new ConnectionConfig("irc.test", 6697, false, "alice", "al", null, null, List.of("#a"));
    ConnectionConfig c = new ConnectionConfig("irc.test", 6697, true, "Alice", null, null, null, null);

    assertEquals("irc.test:6697:alice", a.storageKey());
    assertTrue(a.sameIdentity(b));
    assertFalse(a.sameIdentity(c));
    assertFalse(a.sameIdentity(null));
  }

  @Test
  void profileOrderIsServerThenPortThenNickname() {
    ConnectionConfig b6667 = new ConnectionConfig("b", 6667, false, "z", null, null, null, null);
    ConnectionConfig a6697 = new ConnectionConfig("a", 6697, false, "a", null, null, null, null);
    ConnectionConfig a6667y = new ConnectionConfig("a", 6667, false, "y", null, null, null, null);
    ConnectionConfig a6667x = new ConnectionConfig("a", 6667, false, "x", null, null, null, null);

    List<ConnectionConfig> sorted = new ArrayList<>(List.of(b6667, a6697, a6667y, a6667x));
    sorted.sort(ConnectionConfig.PROFILE_ORDER);

    assertEquals(List.of(a6667x, a6667y, a6697, b6667), sorted);
  }

  @Test
  void autoJoinIsCopied() {
    List<String> channels = new ArrayList<>(List.of("#a"));
    ConnectionConfig cfg =
        new ConnectionConfig("irc.test", 6667, false, "alice", null, null, null, channels);
    channels.add("#b");

    assertEquals(List.of("#a"), cfg.autoJoin());
  }

  @Test
  void jsonUsesCamelCaseFieldsAndOmitsDerivedKey() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    ConnectionConfig cfg =
        new ConnectionConfig("irc.test", 6697, true, "alice", null, "Alice", null, List.of("#a"));

    JsonNode tree = mapper.readTree(mapper.writeValueAsString(cfg));

    assertTrue(tree.get("useTls").asBoolean());
    assertEquals("#a", tree.get("autoJoin").get(0).asText());
    assertFalse(tree.has("storageKey"));
    assertEquals(cfg, mapper.treeToValue(tree, ConnectionConfig.class));
  }

  @Test
  void rejectsLineBreaksInAnythingSentDuringRegistration() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ConnectionConfig("irc.test", 6667, false, "al\r\nQUIT", null, null, null, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ConnectionConfig("irc.test", 6667, false, "alice", "al\nJOIN", null, null, null));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ConnectionConfig("irc.test", 6667, false, "alice", null, "A\nJOIN #x", null, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ConnectionConfig("irc.test", 6667, false, "alice", null, null, "pw\r\n", null));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ConnectionConfig(
                "irc.test", 6667, false, "alice", null, null, null, List.of("#a\r\nQUIT")));
  }

  @Test
  void nicknameAndChannelsMustBeSingleWords() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ConnectionConfig("irc.test", 6667, false, "al ice", null, null, null, null));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ConnectionConfig("irc.test", 6667, false, "alice", null, null, null, List.of("")));
    assertThrows(
        NullPointerException.class,
        () -> new ConnectionConfig("irc.test", 6667, false, null, null, null, null, null));
  }

  @Test
  void realnameMayContainSpaces() {
    ConnectionConfig cfg =
        new ConnectionConfig("irc.test", 6667, false, "alice", null, "Alice Liddell", null, null);

    assertEquals("Alice Liddell", cfg.realname());
  }
}
