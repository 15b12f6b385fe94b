package se.alipsa.sqlseries;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.sqlseries.engine.SeriesJoinCompiler;

class TimeSeriesTest {

  /** Host query that records calls and returns itself, like a mutable builder. */
  private static final class RecordingQuery implements SeriesQueryTarget<RecordingQuery> {
    private final List<String> calls = new ArrayList<>();

    @Override
    public RecordingQuery joins(String rawJoin) {
      calls.add("JOIN " + rawJoin);
      return this;
    }

    @Override
    public RecordingQuery order(String rawOrder) {
      calls.add("ORDER " + rawOrder);
      return this;
    }
  }

  @Test
  void attachesJoinThenOrder() {
    RecordingQuery query = new RecordingQuery();
    RecordingQuery result = TimeSeries.attach(query, SeriesRange.MONTHS_OF_YEAR);
    assertSame(query, result);
    assertEquals(List.of("JOIN " + SeriesJoinCompiler.build(SeriesRange.MONTHS_OF_YEAR).joinFragment(),
        "ORDER month ASC"), query.calls);
  }

  @Test
  void stringOverrideIsNormalized() {
    RecordingQuery query = TimeSeries.attach(new RecordingQuery(), SeriesRange.DAYS_OF_YEAR, "day = created_at");
    assertEquals("JOIN " + SeriesJoinCompiler.build(SeriesRange.DAYS_OF_YEAR, "day = created_at").joinFragment(),
        query.calls.get(0));
    assertEquals("ORDER day ASC", query.calls.get(1));
  }

  @Test
  void nonStringOverrideBehavesLikeNoOverride() {
    List<String> expected = TimeSeries.attach(new RecordingQuery(), SeriesRange.DAYS_OF_YEAR).calls;
    assertEquals(expected, TimeSeries.attach(new RecordingQuery(), SeriesRange.DAYS_OF_YEAR, Boolean.TRUE).calls);
    assertEquals(expected, TimeSeries.attach(new RecordingQuery(), SeriesRange.DAYS_OF_YEAR, 1).calls);
    assertEquals(expected, TimeSeries.attach(new RecordingQuery(), SeriesRange.DAYS_OF_YEAR, (Object) null).calls);
  }

  @Test
  void scopeCanBeReused() {
    SeriesScope scope = TimeSeries.scope(SeriesRange.DAYS_OF_YEAR, JoinOverride.clause("created_at"));
    RecordingQuery first = scope.apply(new RecordingQuery());
    RecordingQuery second = scope.apply(new RecordingQuery());
    assertEquals(first.calls, second.calls);
    assertEquals("created_at", scope.join().condition());
  }
}
