package se.alipsa.sqlseries;

import java.util.Locale;

/**
 * The calendar series shapes that can be joined against a table of timestamped
 * records.
 *
 * <p>
 * Each constant carries the expressions passed to {@code generate_series}
 * together with the label of the generated column and the join condition used
 * when the caller does not supply one. The expressions are trusted constants
 * and are spliced into the generated SQL as is.
 * </p>
 */
public enum SeriesRange {

  /** One row per day of the current year. */
  DAYS_OF_YEAR("INTERVAL '1 day'", "day"),

  /** One row per month of the current year. */
  MONTHS_OF_YEAR("INTERVAL '1 month'", "month");

  private static final String YEAR_START = "date_trunc('year', now())";
  private static final String YEAR_END = YEAR_START + " + INTERVAL '1 year - 1 day'";

  private final String stepInterval;
  private final String stepLabel;
  private final String defaultJoinCondition;

  SeriesRange(String stepInterval, String stepLabel) {
    this.stepInterval = stepInterval;
    this.stepLabel = stepLabel;
    this.defaultJoinCondition = stepLabel + " = date_trunc('" + stepLabel + "', created_at)";
  }

  /**
   * The expression evaluating to the first instant of the series.
   *
   * @return the start expression
   */
  public String startExpression() {
    return YEAR_START;
  }

  /**
   * The expression evaluating to the last instant of the series.
   *
   * @return the end expression
   */
  public String endExpression() {
    return YEAR_END;
  }

  /**
   * The increment between two generated rows.
   *
   * @return the step interval expression, e.g. {@code INTERVAL '1 day'}
   */
  public String stepInterval() {
    return stepInterval;
  }

  /**
   * The alias of the generated column. Doubles as the {@code date_trunc}
   * precision and as the ordering key.
   *
   * @return the step label, e.g. {@code day}
   */
  public String stepLabel() {
    return stepLabel;
  }

  /**
   * The condition matching a series row to the {@code created_at} column of the
   * joined table.
   *
   * @return the default join condition
   */
  public String defaultJoinCondition() {
    return defaultJoinCondition;
  }

  /**
   * Resolve a range by its step label or constant name. Plural labels are
   * accepted as well, so {@code day}, {@code days} and {@code days_of_year} all
   * resolve to {@link #DAYS_OF_YEAR}.
   *
   * @param name
   *          the name to resolve, case insensitive
   * @return the matching range
   * @throws IllegalArgumentException
   *           if no range matches the name
   */
  public static SeriesRange fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Series range name must not be blank");
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    for (SeriesRange range : values()) {
      String label = range.stepLabel;
      if (key.equals(label) || key.equals(label + "s") || key.equals(range.name().toLowerCase(Locale.ROOT))) {
        return range;
      }
    }
    throw new IllegalArgumentException("Unknown series range: " + name);
  }
}
