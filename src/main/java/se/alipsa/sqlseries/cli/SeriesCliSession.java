package se.alipsa.sqlseries.cli;

import java.io.Closeable;
import java.io.PrintWriter;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import se.alipsa.sqlseries.JoinOverride;
import se.alipsa.sqlseries.SeriesRange;
import se.alipsa.sqlseries.TimeSeries;
import se.alipsa.sqlseries.engine.SeriesJoin;
import se.alipsa.sqlseries.engine.SeriesJoinCompiler;
import se.alipsa.sqlseries.sql.SelectQuery;

/**
 * A simple command processor that previews series joins. Lines starting with
 * "/" are commands; any other line is parsed as a base SELECT and printed with
 * the current series attached.
 */
public class SeriesCliSession implements Closeable {

  private static final String UNKNOWN_VERSION = "DEV";
  private static final Set<String> COMMANDS = Set.of("/exit", "/help", "/range", "/on", "/fragments", "/info");
  /**
   * ANSI color used for the CLI prompt to keep it subtly visible.
   */
  public static final String PROMPT_COLOR = "\u001B[2;37m"; // dim light gray
  /**
   * ANSI code that resets styling after colored segments.
   */
  public static final String ANSI_RESET = "\u001B[0m";
  private SeriesRange range = SeriesRange.DAYS_OF_YEAR;
  private JoinOverride override = JoinOverride.useDefault();
  private final PrintWriter out;
  private final PrintWriter err;

  /**
   * Create a new CLI session.
   *
   * @param out
   *          writer used for standard output
   * @param err
   *          writer used for error output
   */
  public SeriesCliSession(PrintWriter out, PrintWriter err) {
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
  }

  /**
   * Compute the prompt to display to the user.
   *
   * @return the current prompt string
   */
  public String prompt() {
    return PROMPT_COLOR + "sqlseries(" + range.stepLabel() + ")>" + ANSI_RESET + " ";
  }

  /**
   * Handle a single line of input.
   *
   * @param line
   *          the input line
   * @return {@code false} if the session should terminate, {@code true} otherwise
   */
  public boolean handleLine(String line) {
    if (line == null) {
      return false;
    }
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return true;
    }
    if (trimmed.startsWith("/")) {
      return handleCommand(trimmed);
    }
    renderQuery(trimmed);
    return true;
  }

  private boolean handleCommand(String command) {
    String word = commandWord(command);
    String argument = command.substring(word.length()).trim();
    switch (word) {
      case "/exit":
        close();
        return false;
      case "/help":
        printHelp();
        return true;
      case "/range":
        selectRange(argument);
        return true;
      case "/on":
        setOverride(argument);
        return true;
      case "/fragments":
        printFragments();
        return true;
      case "/info":
        printInfo();
        return true;
      default:
        err.println("Unknown command: " + command + ". Use /help to list commands.");
        err.flush();
        return true;
    }
  }

  /**
   * Extract the command word, i.e. the text up to the first whitespace, in
   * lower case.
   *
   * @param line
   *          the input line, e.g. {@code /range month}
   * @return the command word, e.g. {@code /range}
   */
  static String commandWord(String line) {
    String trimmed = line.trim();
    int end = 0;
    while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
      end++;
    }
    return trimmed.substring(0, end).toLowerCase(Locale.ROOT);
  }

  /**
   * Check whether a line starts with a command this session understands.
   *
   * @param line
   *          the input line
   * @return {@code true} for a known command
   */
  public static boolean isKnownCommand(String line) {
    return line != null && COMMANDS.contains(commandWord(line));
  }

  /**
   * Select the series range used for subsequent queries.
   *
   * @param name
   *          the range name, e.g. {@code day} or {@code month}
   */
  public void selectRange(String name) {
    if (name == null || name.isBlank()) {
      err.println("Usage: /range <day|month>");
      err.flush();
      return;
    }
    try {
      range = SeriesRange.fromName(name);
      out.println(PROMPT_COLOR + "Series range set to " + range.stepLabel() + ANSI_RESET);
      out.flush();
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.flush();
    }
  }

  /**
   * Set or clear the join override.
   *
   * @param clause
   *          the override clause; blank resets to the default condition
   */
  public void setOverride(String clause) {
    if (clause == null || clause.isBlank()) {
      override = JoinOverride.useDefault();
      out.println("Join condition reset to default.");
    } else {
      override = JoinOverride.clause(clause);
      out.println("Join condition: " + currentJoin().condition());
    }
    out.flush();
  }

  private void renderQuery(String sql) {
    try {
      SelectQuery query = TimeSeries.attach(SelectQuery.of(sql), range, override);
      out.println(query.toSql());
      out.flush();
    } catch (IllegalArgumentException e) {
      err.println("Query could not be prepared: " + rootMessage(e));
      err.flush();
    }
  }

  private void printFragments() {
    SeriesJoin join = currentJoin();
    out.println("JOIN:  " + join.joinFragment());
    out.println("ORDER: " + join.orderFragment());
    out.flush();
  }

  private void printInfo() {
    SeriesJoin join = currentJoin();
    out.println("Version: " + cliVersion());
    out.println("Range: " + range.name());
    out.println("Start: " + range.startExpression());
    out.println("End: " + range.endExpression());
    out.println("Step: " + range.stepInterval());
    out.println("Condition: " + join.condition());
    out.println("Override: " + (override instanceof JoinOverride.Clause ? "yes" : "no"));
    out.flush();
  }

  private void printHelp() {
    out.println("Available commands:");
    out.println("/range <day|month> - Select the calendar series");
    out.println("/on <clause> - Override the join condition, e.g. /on day = orders.created_at");
    out.println("/on - Reset the join condition to the series default");
    out.println("/fragments - Show the generated join and order fragments");
    out.println("/info - Show the current series settings");
    out.println("/help - Display this help text");
    out.println("/exit - Exit the CLI");
    out.println("Any other input is treated as a SELECT statement to attach the series to.");
    out.flush();
  }

  private SeriesJoin currentJoin() {
    return SeriesJoinCompiler.build(range, override);
  }

  private static String rootMessage(Throwable t) {
    Throwable cause = t;
    while (cause.getCause() != null && cause.getCause() != cause) {
      cause = cause.getCause();
    }
    String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      return t.getMessage();
    }
    return message.lines().findFirst().orElse(message);
  }

  /**
   * The currently selected range.
   *
   * @return the range
   */
  public SeriesRange range() {
    return range;
  }

  @Override
  public void close() {
    out.flush();
    err.flush();
  }

  /**
   * Resolve the CLI version from the package manifest.
   *
   * @return the implementation version, or {@value #UNKNOWN_VERSION} when not
   *         available
   */
  public static String cliVersion() {
    Package pkg = SeriesCliSession.class.getPackage();
    if (pkg != null) {
      String implementationVersion = pkg.getImplementationVersion();
      if (implementationVersion != null && !implementationVersion.isBlank()) {
        return implementationVersion;
      }
    }
    String sysVersion = System.getProperty("sqlseries.version");
    if (sysVersion != null && !sysVersion.isBlank()) {
      return sysVersion;
    }
    return UNKNOWN_VERSION;
  }
}
