package se.alipsa.sqlseries.cli;

import static se.alipsa.sqlseries.cli.SeriesCliSession.ANSI_RESET;
import static se.alipsa.sqlseries.cli.SeriesCliSession.PROMPT_COLOR;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

/**
 * Entry point for the interactive series join preview.
 */
public final class SeriesCli {

  private static final Logger LOG = LoggerFactory.getLogger(SeriesCli.class);

  static final String LOG_LEVEL_PROPERTY = "sqlseries.logLevel";

  private SeriesCli() {
    // utility class
  }

  /**
   * Start the CLI.
   *
   * @param args
   *          optional first argument naming the initial series range
   *          ({@code day} or {@code month})
   */
  public static void main(String[] args) {
    try {
      configureLogging();
      Terminal terminal = TerminalBuilder.builder().system(true).build();
      Path historyFile = Paths.get(System.getProperty("user.home"), ".sqlseries_history");
      LineReader reader = LineReaderBuilder.builder().terminal(terminal).appName("sqlseries")
          .variable(LineReader.HISTORY_FILE, historyFile).highlighter(new UserInputHighlighter()).build();
      PrintWriter out = new PrintWriter(terminal.output(), true);
      PrintWriter err = new PrintWriter(terminal.output(), true);
      try (SeriesCliSession session = new SeriesCliSession(out, err)) {
        out.println(PROMPT_COLOR + "SqlSeries CLI version " + SeriesCliSession.cliVersion() + ANSI_RESET);
        if (args != null && args.length > 0 && args[0] != null && !args[0].isBlank()) {
          session.selectRange(args[0]);
        }
        boolean running = true;
        while (running) {
          String line;
          try {
            line = reader.readLine(session.prompt());
          } catch (UserInterruptException e) {
            // Continue on interrupt to let users type /exit
            continue;
          } catch (EndOfFileException e) {
            break;
          }
          running = session.handleLine(line);
        }
      }
    } catch (IOException e) {
      LOG.error("Failed to start SqlSeries CLI: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  private static void configureLogging() {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
    System.setProperty(org.slf4j.simple.SimpleLogger.DEFAULT_LOG_LEVEL_KEY, logLevel());
  }

  /**
   * The log level for the CLI, read from the {@value #LOG_LEVEL_PROPERTY} system
   * property.
   *
   * @return the configured level, {@code error} when not set
   */
  static String logLevel() {
    String level = System.getProperty(LOG_LEVEL_PROPERTY);
    if (level == null || level.isBlank()) {
      return "error";
    }
    return level.trim();
  }
}
