package com.crossstitch.publisher.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void maskEmailKeepsFirstCharacterAndDomain() {
    assertEquals("b***@example.com", Logs.maskEmail("bob@Example.com"));
    assertEquals("[REDACTED]", Logs.maskEmail("no-at-sign"));
    assertEquals("<null>", Logs.maskEmail(null));
  }

  @Test
  void truncateAnnotatesLength() {
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
    assertEquals("abc", Logs.truncate("abc", 3));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void redactHidesAnyValue() {
    assertEquals("[REDACTED]", Logs.redact("pina_secret_token"));
    assertEquals("[REDACTED]", Logs.redact(null));
  }
}
