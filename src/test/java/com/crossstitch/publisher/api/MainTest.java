package com.crossstitch.publisher.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    ExitCode code = Main.run(new String[0]);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: publisher <publish|campaign|verify|boards|users|audit>"));
  }

  @Test
  void helpListsCommands() {
    ExitCode code = Main.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Commands:"));
    assertTrue(output.contains("audit       Report designs whose PDFs are missing from storage"));
  }

  @Test
  void unknownCommandIsRejected() {
    ExitCode code = Main.run(new String[] {"capture"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: publisher"));
  }

  @Test
  void commandHelpIsDispatched() {
    ExitCode code = Main.run(new String[] {"BOARDS", "--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Pinboard maintenance"));
  }
}
