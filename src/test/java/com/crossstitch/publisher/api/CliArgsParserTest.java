package com.crossstitch.publisher.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {" batch=./incoming/0007 ", "campaign.broadcastSubject=New = fresh", "verify.environmentName="});

    assertEquals(List.of("batch", "campaign.broadcastSubject", "verify.environmentName"), List.copyOf(map.keySet()));
    assertEquals("./incoming/0007", map.get("batch"));
    assertEquals("New = fresh", map.get("campaign.broadcastSubject"));
    assertEquals("", map.get("verify.environmentName"));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertEquals(Map.of(), CliArgsParser.toMap(null));
    assertEquals(Map.of(), CliArgsParser.toMap(new String[] {null, "  "}));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"batch"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"a=1\u0007"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"a=1", "a=2"}));
  }
}
