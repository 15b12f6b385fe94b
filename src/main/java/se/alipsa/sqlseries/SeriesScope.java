package se.alipsa.sqlseries;

import java.util.Objects;
import se.alipsa.sqlseries.engine.SeriesJoin;

/**
 * A compiled series join that can be applied to any number of queries.
 */
public final class SeriesScope {

  private final SeriesJoin join;

  SeriesScope(SeriesJoin join) {
    this.join = Objects.requireNonNull(join, "join");
  }

  /**
   * Attach the join and then the ordering to a query.
   *
   * @param query
   *          the query, not {@code null}
   * @param <Q>
   *          the query type
   * @return the query returned by the host builder
   */
  public <Q extends SeriesQueryTarget<Q>> Q apply(Q query) {
    Objects.requireNonNull(query, "query");
    return query.joins(join.joinFragment()).order(join.orderFragment());
  }

  /**
   * The compiled fragments.
   *
   * @return the series join
   */
  public SeriesJoin join() {
    return join;
  }
}
