package com.novelvision.visualization;

import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the YAML application configuration. {@code ${env:NAME}} and {@code ${sys:name}}
 * placeholders are resolved on access by the configuration's default interpolator.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  /**
   * @param configFile path to a YAML file, or {@code null} to load the classpath resource {@value
   *     #DEFAULT_RESOURCE}
   */
  public ConfigurationProvider(String configFile) {
    this.config = new YAMLConfiguration();
    if (configFile == null || configFile.isBlank()) {
      loadResource();
    } else {
      loadFile(Path.of(configFile));
    }
  }

  private void loadResource() {
    InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      throw new VisualizationException(
          VisualizationErrorCode.CONFIGURATION_ERROR,
          "Classpath resource " + DEFAULT_RESOURCE + " not found");
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      config.read(reader);
      log.info("Loaded configuration from classpath:{}", DEFAULT_RESOURCE);
    } catch (ConfigurationException | IOException e) {
      throw new VisualizationException(
          VisualizationErrorCode.CONFIGURATION_ERROR,
          "Could not read classpath resource " + DEFAULT_RESOURCE,
          e);
    }
  }

  private void loadFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new VisualizationException(
              VisualizationErrorCode.CONFIGURATION_ERROR, "Configuration file not found: " + path)
          .withContext("path", path.toString());
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      config.read(reader);
      log.info("Loaded configuration from {}", path.toAbsolutePath());
    } catch (ConfigurationException | IOException e) {
      throw new VisualizationException(
              VisualizationErrorCode.CONFIGURATION_ERROR, "Could not read configuration " + path, e)
          .withContext("path", path.toString());
    }
  }

  public Configuration config() {
    return config;
  }
}
