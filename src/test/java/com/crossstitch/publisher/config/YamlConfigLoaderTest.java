package com.crossstitch.publisher.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("publisher.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          aws:
            region: eu-west-1
        publish:
          dryRun: true
          converter:
            timeoutSeconds: 30
        campaign:
          campaign:
            sender: ann@cross-stitch.com
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "publish");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("eu-west-1", map.get("aws.region"));
    assertEquals("true", map.get("dryRun"));
    assertEquals("30", map.get("converter.timeoutSeconds"));
    assertFalse(map.containsKey("campaign.sender"));
  }

  @Test
  void modeSectionOverridesCommonAndMatchesCaseInsensitively() throws IOException {
    Path yaml = tempDir.resolve("override.yaml");
    Files.writeString(yaml, """
        common:
          site:
            baseUrl: https://common.example.com
        Campaign:
          site:
            baseUrl: https://campaign.example.com
          campaign:
            adminEmail:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, " CAMPAIGN ").orElseThrow();

    assertEquals("https://campaign.example.com", map.get("site.baseUrl"));
    assertEquals("", map.get("campaign.adminEmail"));
  }

  @Test
  void scalarListsAreJoined() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        audit:
          variants: [1, 3, " 5 "]
        """);

    assertEquals("1,3,5", YamlConfigLoader.load(yaml, "audit").orElseThrow().get("variants"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "publish").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "publish").orElseThrow());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - publish:
            dryRun: true
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "publish"));
  }

  @Test
  void nestedListsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("nested-list.yaml");
    Files.writeString(yaml, """
        publish:
          bad:
            - [1, 2]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "publish"));
  }

  @Test
  void malformedYamlThrows() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "publish: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "publish"));
  }
}
