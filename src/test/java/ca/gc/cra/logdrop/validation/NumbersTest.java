package ca.gc.cra.logdrop.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(5, Numbers.requireRange("limit", 5, 1, 10));
    assertEquals(10L, Numbers.requireRange("interval", 10L, 1L, 10L));
  }

  @Test
  void requireRangeReportsValueOutsideBounds() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("limit", 0, 1, 10));
    assertEquals("limit must be between 1 and 10 (was 0)", ex.getMessage());
  }
}
