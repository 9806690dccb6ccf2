package ca.gc.cra.logdrop.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class MetricKeyTest {

  @Test
  void outputKeysMoveNameIntoAttribute() {
    assertEquals(new MetricKey("logdrop.output.dropped.full", "files"), MetricKey.parse("output.files.dropped.full"));
  }

  @Test
  void otherKeysArePrefixed() {
    assertEquals(new MetricKey("logdrop.input.tcp.records", null), MetricKey.parse("input.tcp.records"));
  }

  @Test
  void malformedOutputKeyIsKeptWhole() {
    assertEquals(new MetricKey("logdrop.output.files", null), MetricKey.parse("output.files"));
  }

  @Test
  void sanitizesAndLowercases() {
    assertEquals(new MetricKey("logdrop.dispatcher.record.dropped.missingfield", null),
        MetricKey.parse("dispatcher.record.dropped.missingField"));
    assertEquals(new MetricKey("logdrop.a_b", null), MetricKey.parse("a b"));
    assertEquals(new MetricKey("logdrop.metric", null), MetricKey.parse(" "));
  }
}
