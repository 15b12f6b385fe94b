package se.alipsa.sqlseries;

import se.alipsa.sqlseries.engine.SeriesJoinCompiler;

/**
 * Entry point for attaching a calendar series to a query. Example usage:
 *
 * <pre>
 * <code>
 *   SelectQuery query = SelectQuery.of("SELECT COUNT(orders.id) AS total FROM orders");
 *   String sql = TimeSeries.attach(query, SeriesRange.MONTHS_OF_YEAR).toSql();
 *   // ... RIGHT JOIN LATERAL (SELECT * FROM generate_series(...) month) series
 *   //     ON month = date_trunc('month', created_at) ORDER BY month ASC
 * </code>
 * </pre>
 */
public final class TimeSeries {

  private TimeSeries() {
  }

  /**
   * Attach a series using the range's default join condition.
   *
   * @param query
   *          the host query
   * @param range
   *          the series range
   * @param <Q>
   *          the query type
   * @return the query with the series join and ordering attached
   */
  public static <Q extends SeriesQueryTarget<Q>> Q attach(Q query, SeriesRange range) {
    return scope(range).apply(query);
  }

  /**
   * Attach a series with an explicit override.
   *
   * @param query
   *          the host query
   * @param range
   *          the series range
   * @param override
   *          the join override; {@code null} selects the default condition
   * @param <Q>
   *          the query type
   * @return the query with the series join and ordering attached
   */
  public static <Q extends SeriesQueryTarget<Q>> Q attach(Q query, SeriesRange range, JoinOverride override) {
    return scope(range, override).apply(query);
  }

  /**
   * Attach a series with a loosely typed override. A {@link String} is used as
   * the join clause; any other value, {@code null} included, selects the
   * default condition.
   *
   * @param query
   *          the host query
   * @param range
   *          the series range
   * @param override
   *          the override argument
   * @param <Q>
   *          the query type
   * @return the query with the series join and ordering attached
   */
  public static <Q extends SeriesQueryTarget<Q>> Q attach(Q query, SeriesRange range, Object override) {
    return attach(query, range, JoinOverride.of(override));
  }

  /**
   * Compile a reusable scope with the default join condition.
   *
   * @param range
   *          the series range
   * @return the scope
   */
  public static SeriesScope scope(SeriesRange range) {
    return scope(range, JoinOverride.useDefault());
  }

  /**
   * Compile a reusable scope.
   *
   * @param range
   *          the series range
   * @param override
   *          the join override
   * @return the scope
   */
  public static SeriesScope scope(SeriesRange range, JoinOverride override) {
    return new SeriesScope(SeriesJoinCompiler.build(range, override));
  }
}
