package se.alipsa.sqlseries.cli;

import java.util.regex.Pattern;
import org.jline.reader.Highlighter;
import org.jline.reader.LineReader;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

/**
 * Colors CLI input by kind: session commands, unknown commands and SQL text
 * each get their own style so a mistyped command is visible before it is
 * submitted.
 */
public class UserInputHighlighter implements Highlighter {

  /** Style of a known command such as {@code /range}. */
  static final AttributedStyle COMMAND_STYLE = AttributedStyle.BOLD.foreground(AttributedStyle.CYAN);
  /** Style of a line starting with {@code /} that is not a command. */
  static final AttributedStyle UNKNOWN_COMMAND_STYLE = AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
  /** Style of SQL input. */
  static final AttributedStyle SQL_STYLE = AttributedStyle.DEFAULT.foreground(AttributedStyle.WHITE)
      .bold();

  /**
   * Style the buffer according to what it will do when submitted.
   *
   * @param reader
   *          the active line reader, not used
   * @param buffer
   *          the text being entered by the user
   * @return the styled input
   */
  @Override
  public AttributedString highlight(LineReader reader, String buffer) {
    String content = buffer == null ? "" : buffer;
    return new AttributedString(content, styleFor(content));
  }

  /**
   * Pick the style for a line of input.
   *
   * @param content
   *          the input line
   * @return the style used to render it
   */
  static AttributedStyle styleFor(String content) {
    String trimmed = content.trim();
    if (!trimmed.startsWith("/")) {
      return SQL_STYLE;
    }
    return SeriesCliSession.isKnownCommand(trimmed) ? COMMAND_STYLE : UNKNOWN_COMMAND_STYLE;
  }

  @Override
  public void setErrorIndex(int errorIndex) {
    // styling depends on the command word only
  }

  @Override
  public void setErrorPattern(Pattern pattern) {
    // styling depends on the command word only
  }
}
