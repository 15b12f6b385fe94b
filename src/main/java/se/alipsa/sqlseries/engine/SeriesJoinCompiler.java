package se.alipsa.sqlseries.engine;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.sqlseries.JoinOverride;
import se.alipsa.sqlseries.SeriesRange;

/**
 * Compiles a {@link SeriesRange} and an optional {@link JoinOverride} into the
 * join and order fragments of a series query.
 *
 * <p>
 * The join is a {@code RIGHT JOIN LATERAL} of {@code generate_series} so that
 * every generated row survives even when no record matches it. Inputs are
 * trusted text: nothing is escaped and nothing is validated, so a malformed
 * override only surfaces when the database executes the query.
 * </p>
 */
public final class SeriesJoinCompiler {

  private static final Logger log = LoggerFactory.getLogger(SeriesJoinCompiler.class);

  static final String SERIES_ALIAS = "series";

  private SeriesJoinCompiler() {
  }

  /**
   * Compile using the range's default join condition.
   *
   * @param range
   *          the series range, not {@code null}
   * @return the compiled fragments
   */
  public static SeriesJoin build(SeriesRange range) {
    return build(range, JoinOverride.useDefault());
  }

  /**
   * Compile using a raw override clause.
   *
   * @param range
   *          the series range, not {@code null}
   * @param clause
   *          the override clause; {@code null} means the default condition
   * @return the compiled fragments
   */
  public static SeriesJoin build(SeriesRange range, String clause) {
    return build(range, JoinOverride.of(clause));
  }

  /**
   * Compile the join and order fragments.
   *
   * @param range
   *          the series range, not {@code null}
   * @param override
   *          the join override; {@code null} means the default condition
   * @return the compiled fragments
   */
  public static SeriesJoin build(SeriesRange range, JoinOverride override) {
    Objects.requireNonNull(range, "range");
    String condition = JoinConditions.resolve(range, JoinOverride.of(override));
    SeriesJoin join = new SeriesJoin(range, condition, joinFragment(range, condition), orderFragment(range));
    log.debug("Compiled {} series join: {}", range, join.joinFragment());
    return join;
  }

  static String joinFragment(SeriesRange range, String condition) {
    return "RIGHT JOIN LATERAL (SELECT * FROM generate_series(" + range.startExpression() + ", "
        + range.endExpression() + ", " + range.stepInterval() + ") " + range.stepLabel() + ") " + SERIES_ALIAS
        + " ON " + condition;
  }

  static String orderFragment(SeriesRange range) {
    return range.stepLabel() + " ASC";
  }
}
