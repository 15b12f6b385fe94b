package se.alipsa.sqlseries.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.sqlseries.SeriesQueryTarget;

/**
 * A plain SELECT statement that raw joins and ORDER BY items can be appended
 * to.
 *
 * <p>
 * The base statement is parsed with JSqlParser; appended fragments are kept as
 * text and spliced in when the statement is rendered: joins after the existing
 * FROM and JOIN items, order items after the existing ORDER BY keys. Instances
 * are immutable, every append returns a new query.
 * </p>
 */
public final class SelectQuery implements SeriesQueryTarget<SelectQuery> {

  private static final Logger log = LoggerFactory.getLogger(SelectQuery.class);

  private static final String JOIN_MARKER = "sqlseries_join_placeholder_";
  private static final String ORDER_MARKER = "sqlseries_order_placeholder_";

  private final String sql;
  private final List<String> extraJoins;
  private final List<String> extraOrders;

  private SelectQuery(String sql, List<String> extraJoins, List<String> extraOrders) {
    this.sql = sql;
    this.extraJoins = List.copyOf(extraJoins);
    this.extraOrders = List.copyOf(extraOrders);
  }

  /**
   * Parse a base SELECT statement.
   *
   * @param sql
   *          a single plain SELECT statement
   * @return the parsed query
   * @throws IllegalArgumentException
   *           if the text does not parse or is not a plain SELECT
   */
  public static SelectQuery of(String sql) {
    Objects.requireNonNull(sql, "sql");
    PlainSelect plain = parse(sql);
    if (plain.getFromItem() == null) {
      throw new IllegalArgumentException("SELECT without a FROM clause cannot be joined to a series: " + sql);
    }
    return new SelectQuery(sql, List.of(), List.of());
  }

  @Override
  public SelectQuery joins(String rawJoin) {
    Objects.requireNonNull(rawJoin, "rawJoin");
    List<String> joins = new ArrayList<>(extraJoins);
    joins.add(rawJoin.trim());
    return new SelectQuery(sql, joins, extraOrders);
  }

  @Override
  public SelectQuery order(String rawOrder) {
    Objects.requireNonNull(rawOrder, "rawOrder");
    List<String> orders = new ArrayList<>(extraOrders);
    orders.add(rawOrder.trim());
    return new SelectQuery(sql, extraJoins, orders);
  }

  /**
   * The raw joins appended so far.
   *
   * @return an immutable list of join clauses
   */
  public List<String> appendedJoins() {
    return extraJoins;
  }

  /**
   * The raw order items appended so far.
   *
   * @return an immutable list of order items
   */
  public List<String> appendedOrders() {
    return extraOrders;
  }

  /**
   * The statement text the query was parsed from.
   *
   * @return the original SQL
   */
  public String baseSql() {
    return sql;
  }

  /**
   * Render the statement including all appended fragments.
   *
   * <p>
   * JSqlParser renders the statement, so every clause of the base query is
   * kept in its place. Each appended fragment enters the parsed tree as a
   * placeholder (a comma join on a marker table, an ORDER BY on a marker
   * column) that is swapped for the raw text afterwards.
   * </p>
   *
   * @return the SQL text
   */
  public String toSql() {
    // a fresh tree per rendering keeps the placeholders out of later calls
    PlainSelect copy = parse(sql);
    if (!extraJoins.isEmpty()) {
      List<Join> joins = new ArrayList<>(nullSafe(copy.getJoins()));
      for (int i = 0; i < extraJoins.size(); i++) {
        Join placeholder = new Join();
        placeholder.setSimple(true);
        placeholder.setRightItem(new Table(JOIN_MARKER + i));
        joins.add(placeholder);
      }
      copy.setJoins(joins);
    }
    if (!extraOrders.isEmpty()) {
      List<OrderByElement> orders = new ArrayList<>(nullSafe(copy.getOrderByElements()));
      for (int i = 0; i < extraOrders.size(); i++) {
        OrderByElement placeholder = new OrderByElement();
        placeholder.setExpression(new Column(ORDER_MARKER + i));
        orders.add(placeholder);
      }
      copy.setOrderByElements(orders);
    }
    String rendered = copy.toString();
    for (int i = 0; i < extraJoins.size(); i++) {
      rendered = replaceMarker(rendered, ",\\s*" + JOIN_MARKER + i + "\\b", " " + extraJoins.get(i));
    }
    for (int i = 0; i < extraOrders.size(); i++) {
      rendered = replaceMarker(rendered, "\\b" + ORDER_MARKER + i + "\\b", extraOrders.get(i));
    }
    log.debug("Rendered series query: {}", rendered);
    return rendered;
  }

  private static String replaceMarker(String text, String regex, String replacement) {
    Matcher matcher = Pattern.compile(regex).matcher(text);
    if (!matcher.find()) {
      throw new IllegalStateException("Placeholder " + regex + " missing from rendered SQL: " + text);
    }
    return matcher.replaceFirst(Matcher.quoteReplacement(replacement));
  }

  private static PlainSelect parse(String sql) {
    Statement stmt;
    try {
      stmt = CCJSqlParserUtil.parse(sql);
    } catch (JSQLParserException e) {
      throw new IllegalArgumentException("Failed to parse SQL: " + sql, e);
    }
    if (!(stmt instanceof PlainSelect plain)) {
      throw new IllegalArgumentException("SQL statement does not represent a single plain SELECT query: " + sql);
    }
    return plain;
  }

  @Override
  public String toString() {
    return toSql();
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list == null ? Collections.emptyList() : list;
  }
}
