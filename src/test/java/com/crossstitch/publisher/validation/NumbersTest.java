package com.crossstitch.publisher.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1, Numbers.requireRange("attempts", 1, 1, 10));
    assertEquals(10, Numbers.requireRange("attempts", 10, 1, 10));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("attempts", 11, 1, 10));
    assertEquals("attempts must be between 1 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseIntTrimsAndValidates() {
    assertEquals(42, Numbers.parseInt("progressEvery", " 42 ", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("progressEvery", "", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("progressEvery", "4x", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("progressEvery", "0", 1, 100));
  }
}
