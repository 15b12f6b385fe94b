package se.alipsa.sqlseries.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SeriesCliTest {

  @AfterEach
  void clearProperty() {
    System.clearProperty(SeriesCli.LOG_LEVEL_PROPERTY);
  }

  @Test
  void logLevelDefaultsToError() {
    System.clearProperty(SeriesCli.LOG_LEVEL_PROPERTY);
    assertEquals("error", SeriesCli.logLevel());
  }

  @Test
  void logLevelCanBeConfigured() {
    System.setProperty(SeriesCli.LOG_LEVEL_PROPERTY, " debug ");
    assertEquals("debug", SeriesCli.logLevel());
  }
}
