package com.crossstitch.publisher.application.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.domain.error.ConversionException;
import com.crossstitch.publisher.testing.BatchFolders;
import com.crossstitch.publisher.infrastructure.process.LocalProcessRunner;
import com.crossstitch.publisher.testing.FakeProcessRunner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ArtifactConverterTest {
  @TempDir Path tempDir;

  private Path converterExe;
  private Path input;
  private FakeProcessRunner runner;

  @BeforeEach
  void setUp() throws Exception {
    converterExe = tempDir.resolve("converter.exe");
    BatchFolders.write(converterExe, "");
    input = tempDir.resolve("1.pdf");
    BatchFolders.write(input, "source");
    runner = new FakeProcessRunner();
  }

  @Test
  void convertRunsConverterAndReturnsSibling() throws Exception {
    Path output = converter().convert(input);

    assertEquals(tempDir.resolve("1.converted.pdf"), output);
    assertTrue(Files.isRegularFile(output));
    assertEquals(List.of(List.of(converterExe.toString(), input.toString())), runner.invocations());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void successfulConverterWithNonUtf8ChatterStillSucceeds() throws Exception {
    Path script = tempDir.resolve("convert.sh");
    Files.writeString(script, String.join("\n",
        "#!/bin/sh",
        "printf 'Termin\\351 OK\\n'",
        "cp \"$1\" \"${1%.pdf}.converted.pdf\"",
        "exit 0",
        ""));
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
    Path stitch = tempDir.resolve("Stitch1.pdf");
    BatchFolders.write(stitch, "source");

    Path output = new ArtifactConverter(new LocalProcessRunner(), script, Duration.ofSeconds(30)).convert(stitch);

    assertEquals(tempDir.resolve("Stitch1.converted.pdf"), output);
    assertEquals("source", Files.readString(output));
  }

  @Test
  void missingConverterIsConfigurationError() {
    ArtifactConverter converter = new ArtifactConverter(runner, tempDir.resolve("none.exe"), Duration.ofSeconds(5));

    assertThrows(ConfigurationException.class, () -> converter.convert(input));
    assertThrows(ConfigurationException.class, converter::requireConverter);
    assertTrue(runner.invocations().isEmpty());
  }

  @Test
  void missingInputIsConversionError() {
    ConversionException ex = assertThrows(ConversionException.class,
        () -> converter().convert(tempDir.resolve("9.pdf")));

    assertEquals(-1, ex.exitCode());
  }

  @Test
  void nonZeroExitCarriesDiagnostics() {
    runner.failWith(3, "bad xref table");

    ConversionException ex = assertThrows(ConversionException.class, () -> converter().convert(input));

    assertEquals(3, ex.exitCode());
    assertEquals("bad xref table", ex.output());
    assertEquals("Converter failed for 1.pdf (exit 3). bad xref table", ex.getMessage());
  }

  @Test
  void timeoutIsConversionError() {
    runner.timeOut();

    ConversionException ex = assertThrows(ConversionException.class, () -> converter().convert(input));

    assertTrue(ex.getMessage().startsWith("Converter timed out for 1.pdf after 5s"));
  }

  @Test
  void missingOutputIsConversionError() {
    runner.withoutOutput();

    ConversionException ex = assertThrows(ConversionException.class, () -> converter().convert(input));

    assertTrue(ex.getMessage().startsWith("Converter did not produce expected output"));
  }

  @Test
  void convertAllKeepsVariantOrderAndStopsAtFirstFailure() throws Exception {
    Path three = tempDir.resolve("3.pdf");
    BatchFolders.write(three, "source");
    Map<String, Path> variants = new LinkedHashMap<>();
    variants.put("1", input);
    variants.put("3", three);

    Map<String, Path> converted = converter().convertAll(variants);

    assertEquals(List.of("1", "3"), List.copyOf(converted.keySet()));
    assertEquals(tempDir.resolve("3.converted.pdf"), converted.get("3"));

    variants.put("5", tempDir.resolve("5.pdf"));
    assertThrows(ConversionException.class, () -> converter().convertAll(variants));
  }

  @Test
  void outputPathReplacesExtension() {
    assertEquals(Path.of("a", "Kit.converted.pdf"), ArtifactConverter.outputPathFor(Path.of("a", "Kit.pdf")));
    assertEquals(Path.of("noext.converted.pdf"), ArtifactConverter.outputPathFor(Path.of("noext")));
  }

  private ArtifactConverter converter() {
    return new ArtifactConverter(runner, converterExe, Duration.ofSeconds(5));
  }
}
