package se.alipsa.sqlseries.engine;

import java.util.Locale;
import java.util.Objects;
import se.alipsa.sqlseries.JoinOverride;
import se.alipsa.sqlseries.SeriesRange;

/**
 * Derives the {@code ON} condition joining a generated series to the outer
 * query.
 */
public final class JoinConditions {

  static final String TRUNCATE_FUNCTION = "date_trunc";

  private JoinConditions() {
  }

  /**
   * Resolve the effective join condition for a range.
   *
   * <ul>
   * <li>no override: the range's default condition</li>
   * <li>a clause without an equality: the clause unchanged</li>
   * <li>an equality {@code a = b}: both sides truncated to the step label
   * precision</li>
   * </ul>
   *
   * @param range
   *          the series range, not {@code null}
   * @param override
   *          the override, not {@code null}
   * @return the effective condition
   */
  public static String resolve(SeriesRange range, JoinOverride override) {
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(override, "override");
    if (override instanceof JoinOverride.Clause clause) {
      return normalizeEquality(range.stepLabel(), clause.sql().text());
    }
    return range.defaultJoinCondition();
  }

  /**
   * Truncate both sides of an equality to the given precision. Text without a
   * standalone {@code =} is returned as is.
   *
   * @param precision
   *          the {@code date_trunc} precision, e.g. {@code day}
   * @param clause
   *          the clause text
   * @return the normalized clause
   */
  static String normalizeEquality(String precision, String clause) {
    int split = indexOfEquality(clause);
    if (split < 0) {
      return clause;
    }
    String left = truncate(precision, clause.substring(0, split));
    String right = truncate(precision, clause.substring(split + 1));
    return left + " = " + right;
  }

  /**
   * Wrap an expression in {@code date_trunc} unless it already contains a
   * {@code date_trunc} call.
   *
   * @param precision
   *          the truncation precision
   * @param expression
   *          the expression text
   * @return the trimmed expression, truncated to {@code precision}
   */
  public static String truncate(String precision, String expression) {
    String trimmed = expression.trim();
    if (trimmed.toLowerCase(Locale.ROOT).contains(TRUNCATE_FUNCTION)) {
      return trimmed;
    }
    return TRUNCATE_FUNCTION + "('" + precision + "', " + trimmed + ")";
  }

  /**
   * Locate the first equality operator. {@code =} characters that belong to
   * {@code <=}, {@code >=}, {@code !=}, {@code ==} or sit inside a single quoted
   * literal or a double quoted identifier do not count.
   *
   * @param clause
   *          the clause text
   * @return the index of the operator, or -1 when there is none
   */
  static int indexOfEquality(String clause) {
    char quote = 0;
    for (int i = 0; i < clause.length(); i++) {
      char ch = clause.charAt(i);
      if (quote != 0) {
        if (ch == quote) {
          quote = 0;
        }
        continue;
      }
      if (ch == '\'' || ch == '"') {
        quote = ch;
        continue;
      }
      if (ch != '=') {
        continue;
      }
      char prev = i > 0 ? clause.charAt(i - 1) : ' ';
      char next = i + 1 < clause.length() ? clause.charAt(i + 1) : ' ';
      if (prev == '<' || prev == '>' || prev == '!' || prev == '=' || next == '=') {
        continue;
      }
      return i;
    }
    return -1;
  }
}
