package cafe.woden.ircengine.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ConnectionCommandTest {

  @Test
  void tokensAreTrimmed() {
    assertEquals("#a", new ConnectionCommand.Join("  #a ").channel());
    assertEquals("bob", new ConnectionCommand.Privmsg(" bob", "hi").target());
  }

  @Test
  void tokensRejectBlankSpacesAndLineBreaks() {
    assertThrows(IllegalArgumentException.class, () -> new ConnectionCommand.Join(" "));
    assertThrows(IllegalArgumentException.class, () -> new ConnectionCommand.Join("#a #b"));
    assertThrows(IllegalArgumentException.class, () -> new ConnectionCommand.Join("#a\r\nQUIT"));
    assertThrows(NullPointerException.class, () -> new ConnectionCommand.Part(null, null));
  }

  @Test
  void textRejectsLineBreaksButKeepsSpaces() {
    assertEquals("hello there", new ConnectionCommand.Privmsg("#a", "hello there").message());
    assertThrows(
        IllegalArgumentException.class, () -> new ConnectionCommand.Privmsg("#a", "hi\nQUIT"));
    assertThrows(IllegalArgumentException.class, () -> new ConnectionCommand.Quit("bye\r"));
    assertThrows(IllegalArgumentException.class, () -> new ConnectionCommand.Topic("#a", "x\ny"));
  }

  @Test
  void optionalTextStaysNullWhenAbsent() {
    assertNull(new ConnectionCommand.Part("#a", null).reason());
    assertNull(new ConnectionCommand.Topic("#a", null).topic());
    assertNull(new ConnectionCommand.Quit(null).reason());
    assertEquals("", new ConnectionCommand.Privmsg("#a", null).message());
  }
}
