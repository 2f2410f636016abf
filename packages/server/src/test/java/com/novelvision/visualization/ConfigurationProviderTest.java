package com.novelvision.visualization;

import static org.junit.jupiter.api.Assertions.*;

import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.jobs.RetryPolicy;
import com.novelvision.visualization.orchestrator.JobPriorities;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  void loadsBundledConfiguration() {
    Configuration config = new ConfigurationProvider(null).config();

    assertEquals("dalle3", config.getString("providers.default"));
    assertEquals(4, config.getInt("worker.threads"));
    assertEquals("remote", config.getString("prompt.mode"));
  }

  @Test
  void bundledDefaultsMatchPolicies() {
    Configuration config = new ConfigurationProvider(null).config();

    assertEquals(RetryPolicy.defaults(), RetryPolicy.fromConfiguration(config));
    assertEquals(JobPriorities.defaults(), JobPriorities.fromConfiguration(config));
  }

  @Test
  void loadsFileAndFallsBackToDefaults() throws Exception {
    Path file = tempDir.resolve("custom.yaml");
    Files.writeString(
        file,
        String.join(
            "\n",
            "jobs:",
            "  max-retries: 5",
            "  auto-retry:",
            "    enabled: false",
            "  priority:",
            "    auto-novel: 1",
            ""));

    Configuration config = new ConfigurationProvider(file.toString()).config();
    RetryPolicy retry = RetryPolicy.fromConfiguration(config);
    JobPriorities priorities = JobPriorities.fromConfiguration(config);

    assertEquals(5, retry.maxRetries());
    assertFalse(retry.autoRetryEnabled());
    assertEquals(Duration.ofSeconds(30), retry.backoff());
    assertEquals(1, priorities.autoNovel());
    assertEquals(10, priorities.pageRequest());
    assertEquals(15, priorities.textSelection());
  }

  @Test
  void resolvesSystemPropertyPlaceholders() throws Exception {
    Path file = tempDir.resolve("placeholders.yaml");
    Files.writeString(file, "catalog:\n  api-url: ${sys:nv.test.catalog}\n");
    System.setProperty("nv.test.catalog", "http://catalog.test");
    try {
      Configuration config = new ConfigurationProvider(file.toString()).config();
      assertEquals("http://catalog.test", config.getString("catalog.api-url"));
    } finally {
      System.clearProperty("nv.test.catalog");
    }
  }

  @Test
  void missingFileIsConfigurationError() {
    String missing = tempDir.resolve("absent.yaml").toString();

    VisualizationException ex =
        assertThrows(VisualizationException.class, () -> new ConfigurationProvider(missing));

    assertEquals(VisualizationErrorCode.CONFIGURATION_ERROR, ex.getCode());
    assertEquals(missing, ex.getContext().get("path"));
  }
}
