package se.alipsa.sqlseries.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import se.alipsa.sqlseries.JoinOverride;
import se.alipsa.sqlseries.SeriesRange;

class JoinConditionsTest {

  @Test
  void defaultOverrideUsesRangeCondition() {
    assertEquals("day = date_trunc('day', created_at)",
        JoinConditions.resolve(SeriesRange.DAYS_OF_YEAR, JoinOverride.useDefault()));
    assertEquals("month = date_trunc('month', created_at)",
        JoinConditions.resolve(SeriesRange.MONTHS_OF_YEAR, JoinOverride.useDefault()));
  }

  @Test
  void clauseWithoutEqualityIsUsedVerbatim() {
    assertEquals("created_at", JoinConditions.resolve(SeriesRange.DAYS_OF_YEAR, JoinOverride.clause("created_at")));
    assertEquals("day BETWEEN a AND b",
        JoinConditions.resolve(SeriesRange.DAYS_OF_YEAR, JoinOverride.clause("day BETWEEN a AND b")));
  }

  @Test
  void equalityTruncatesBothSides() {
    assertEquals("date_trunc('day', day) = date_trunc('day', created_at)",
        JoinConditions.resolve(SeriesRange.DAYS_OF_YEAR, JoinOverride.clause("day = created_at")));
    assertEquals("date_trunc('month', month) = date_trunc('month', o.paid_at)",
        JoinConditions.resolve(SeriesRange.MONTHS_OF_YEAR, JoinOverride.clause("month=o.paid_at")));
  }

  @Test
  void alreadyTruncatedSidesAreLeftAlone() {
    assertEquals("date_trunc('month', month) = date_trunc('month', created_at)", JoinConditions
        .resolve(SeriesRange.MONTHS_OF_YEAR, JoinOverride.clause("month = date_trunc('month', created_at)")));
    assertEquals("DATE_TRUNC('day', created_at)", JoinConditions.truncate("day", " DATE_TRUNC('day', created_at) "));
  }

  @Test
  void truncationIsIdempotent() {
    String once = JoinConditions.truncate("day", "created_at");
    assertEquals("date_trunc('day', created_at)", once);
    assertEquals(once, JoinConditions.truncate("day", once));
  }

  @Test
  void splitsOnFirstStandaloneEqualsOnly() {
    assertEquals("date_trunc('day', day) = date_trunc('day', created_at AND flag = true)",
        JoinConditions.normalizeEquality("day", "day = created_at AND flag = true"));
  }

  @Test
  void comparisonOperatorsAndQuotedEqualsAreNotSplitPoints() {
    assertEquals(-1, JoinConditions.indexOfEquality("day >= created_at"));
    assertEquals(-1, JoinConditions.indexOfEquality("day <= created_at"));
    assertEquals(-1, JoinConditions.indexOfEquality("day != created_at"));
    assertEquals(-1, JoinConditions.indexOfEquality("note LIKE 'a=b'"));
    assertEquals(4, JoinConditions.indexOfEquality("day = created_at"));
    assertEquals("day >= created_at", JoinConditions.normalizeEquality("day", "day >= created_at"));
  }

  @Test
  void equalsInsideQuotedIdentifierIsNotASplitPoint() {
    assertEquals(6, JoinConditions.indexOfEquality("\"a=b\" = created_at"));
    assertEquals("date_trunc('day', \"a=b\") = date_trunc('day', created_at)",
        JoinConditions.normalizeEquality("day", "\"a=b\" = created_at"));
    assertEquals(-1, JoinConditions.indexOfEquality("\"it's=odd\" > 'x=\"y'"));
  }
}
