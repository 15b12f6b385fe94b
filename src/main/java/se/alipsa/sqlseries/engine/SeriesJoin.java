package se.alipsa.sqlseries.engine;

import java.util.Objects;
import se.alipsa.sqlseries.SeriesRange;

/**
 * The SQL fragments that attach a calendar series to a query.
 *
 * @param range
 *          the range the fragments were compiled from
 * @param condition
 *          the effective {@code ON} condition
 * @param joinFragment
 *          the lateral join of the generated series
 * @param orderFragment
 *          the ORDER BY item sorting by the series column
 */
public record SeriesJoin(SeriesRange range, String condition, String joinFragment, String orderFragment) {

  /**
   * Canonical constructor.
   *
   * @param range
   *          the range, not {@code null}
   * @param condition
   *          the condition, not {@code null}
   * @param joinFragment
   *          the join fragment, not {@code null}
   * @param orderFragment
   *          the order fragment, not {@code null}
   */
  public SeriesJoin {
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(joinFragment, "joinFragment");
    Objects.requireNonNull(orderFragment, "orderFragment");
  }
}
