package ca.gc.cra.logdrop.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("hello", Logs.truncate("hello", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void longValuesAreCutAtByteBudget() {
    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void multiByteCharactersAreNotSplit() {
    String truncated = Logs.truncate("ééé", 3);
    assertTrue(truncated.startsWith("é... (truncated"), truncated);
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void dumpBoundsRecordDescriptions() {
    String dump = Logs.dump("x".repeat(Logs.RECORD_DUMP_BYTES * 2));
    assertTrue(dump.contains("(truncated, " + Logs.RECORD_DUMP_BYTES + " of "), dump);
  }
}
