package se.alipsa.sqlseries.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jline.utils.AttributedString;
import org.junit.jupiter.api.Test;

class UserInputHighlighterTest {

  private final UserInputHighlighter highlighter = new UserInputHighlighter();

  @Test
  void knownCommandsUseTheCommandStyle() {
    AttributedString styled = highlighter.highlight(null, "/range month");
    assertEquals("/range month", styled.toString());
    assertEquals(UserInputHighlighter.COMMAND_STYLE, styled.styleAt(0));
    assertEquals(UserInputHighlighter.COMMAND_STYLE, UserInputHighlighter.styleFor("  /ON day = created_at"));
    assertEquals(UserInputHighlighter.COMMAND_STYLE, UserInputHighlighter.styleFor("/fragments"));
  }

  @Test
  void unknownCommandsAreFlagged() {
    assertEquals(UserInputHighlighter.UNKNOWN_COMMAND_STYLE, UserInputHighlighter.styleFor("/only"));
    assertEquals(UserInputHighlighter.UNKNOWN_COMMAND_STYLE, UserInputHighlighter.styleFor("/ranges day"));
    assertEquals(UserInputHighlighter.UNKNOWN_COMMAND_STYLE,
        highlighter.highlight(null, "/bogus").styleAt(0));
  }

  @Test
  void sqlInputUsesTheSqlStyle() {
    AttributedString styled = highlighter.highlight(null, "select * from orders");
    assertEquals(UserInputHighlighter.SQL_STYLE, styled.styleAt(0));
    assertTrue(styled.toAnsi().contains("select * from orders"));
  }

  @Test
  void emptyBufferRendersNothing() {
    assertTrue(highlighter.highlight(null, "").toAnsi().isEmpty());
    assertTrue(highlighter.highlight(null, null).toAnsi().isEmpty());
  }
}
