package cafe.woden.ircengine.irc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IrcLineCodecTest {

  @Test
  void parsesPrefixCommandParamsAndTrailing() {
    IrcLine line = IrcLineCodec.parse(":nick!user@host PRIVMSG #chan :hello world");

    assertEquals("nick!user@host", line.prefix());
    assertEquals("PRIVMSG", line.command());
    assertEquals(List.of("#chan"), line.params());
    assertEquals("hello world", line.trailing());
    assertEquals(Optional.of("nick"), line.sourceNick());
  }

  @Test
  void lineWithoutPrefixOrTrailing() {
    IrcLine line = IrcLineCodec.parse("JOIN #a");

    assertNull(line.prefix());
    assertEquals("JOIN", line.command());
    assertEquals(List.of("#a"), line.params());
    assertNull(line.trailing());
    assertTrue(line.sourceNick().isEmpty());
  }

  @Test
  void trailingIsSplitAtFirstSpaceColonOnly() {
    IrcLine line = IrcLineCodec.parse(":srv 332 me #c :a :b c");

    assertEquals(List.of("me", "#c"), line.params());
    assertEquals("a :b c", line.trailing());
  }

  @Test
  void emptyTrailingIsPresentButEmpty() {
    IrcLine line = IrcLineCodec.parse(":srv 332 me #c :");

    assertEquals(Optional.of(""), line.trailingText());
  }

  @Test
  void surroundingWhitespaceIsIgnoredAndRunsOfSpacesCollapse() {
    IrcLine line = IrcLineCodec.parse("  PING   a   b  \r");

    assertEquals("PING", line.command());
    assertEquals(List.of("a", "b"), line.params());
  }

  @Test
  void degenerateInputNeverThrows() {
    assertEquals("", IrcLineCodec.parse("").command());
    assertEquals("", IrcLineCodec.parse(null).command());
    assertEquals("", IrcLineCodec.parse("   ").command());

    IrcLine prefixOnly = IrcLineCodec.parse(":x");
    assertNull(prefixOnly.prefix());
    assertEquals(":x", prefixOnly.command());
    assertTrue(prefixOnly.params().isEmpty());

    IrcLine trailingOnly = IrcLineCodec.parse(" :just text");
    assertEquals("", trailingOnly.command());
  }

  @Test
  void nickFromPrefixHandlesServersAndEmptyNicks() {
    assertEquals(Optional.of("alice"), IrcLineCodec.nickFromPrefix("alice!a@host"));
    assertEquals(Optional.of("irc.example.net"), IrcLineCodec.nickFromPrefix("irc.example.net"));
    assertTrue(IrcLineCodec.nickFromPrefix("!user@host").isEmpty());
    assertTrue(IrcLineCodec.nickFromPrefix(null).isEmpty());
  }

  @Test
  void namesEntriesKeepSigilOrder() {
    List<ChannelUser> users = IrcLineCodec.parseNamesList("@+bob  carol ~&dave %erin");

    assertEquals(4, users.size());
    assertEquals(new ChannelUser("bob", List.of(ChannelRole.OP, ChannelRole.VOICE)), users.get(0));
    assertEquals(List.of("op", "voice"), users.get(0).modes());
    assertEquals(new ChannelUser("carol", List.of()), users.get(1));
    assertEquals(List.of("owner", "admin"), users.get(2).modes());
    assertEquals("dave", users.get(2).nick());
    assertEquals(List.of(ChannelRole.HALFOP), users.get(3).roles());
  }

  @Test
  void namesListOfNothingIsEmpty() {
    assertTrue(IrcLineCodec.parseNamesList(null).isEmpty());
    assertTrue(IrcLineCodec.parseNamesList("   ").isEmpty());
  }

  @Test
  void unknownSigilStartsTheNick() {
    ChannelUser user = IrcLineCodec.parseNamesEntry("@!odd");

    assertEquals("!odd", user.nick());
    assertEquals(List.of(ChannelRole.OP), user.roles());
  }

  @Test
  void ctcpActionIsDecoded() {
    assertEquals(Optional.of("waves"), IrcLineCodec.parseCtcpAction("\u0001ACTION waves\u0001"));
    assertEquals(
        Optional.of("double wrapped"),
        IrcLineCodec.parseCtcpAction("\u0001\u0001ACTION double wrapped\u0001\u0001"));
  }

  @Test
  void nonActionCtcpAndPlainTextAreNotActions() {
    assertTrue(IrcLineCodec.parseCtcpAction("\u0001VERSION\u0001").isEmpty());
    assertTrue(IrcLineCodec.parseCtcpAction("ACTION waves").isEmpty());
    assertTrue(IrcLineCodec.parseCtcpAction("\u0001action waves\u0001").isEmpty());
    assertTrue(IrcLineCodec.parseCtcpAction("\u0001").isEmpty());
    assertTrue(IrcLineCodec.parseCtcpAction("").isEmpty());
  }
}
