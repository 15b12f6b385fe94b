package se.alipsa.sqlseries;

/**
 * The part of a host query builder that a series join needs: the ability to
 * append a raw join and a raw ORDER BY item.
 *
 * <p>
 * Implementations may mutate and return {@code this} or return a new
 * instance; callers always continue with the returned query.
 * </p>
 *
 * @param <Q>
 *          the concrete query type, returned for chaining
 */
public interface SeriesQueryTarget<Q extends SeriesQueryTarget<Q>> {

  /**
   * Append a raw join clause.
   *
   * @param rawJoin
   *          the complete join clause, e.g. {@code RIGHT JOIN ... ON ...}
   * @return the query with the join attached
   */
  Q joins(String rawJoin);

  /**
   * Append a raw ORDER BY item.
   *
   * @param rawOrder
   *          the order item, e.g. {@code day ASC}
   * @return the query with the ordering attached
   */
  Q order(String rawOrder);
}
