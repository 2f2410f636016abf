package com.novelvision.visualization;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.MapConfiguration;
import org.apache.commons.configuration2.convert.DisabledListDelimiterHandler;

/**
 * Command line parameters in {@code --name=value} form. A bare {@code --flag} is recorded as
 * {@code true}; anything else is rejected.
 */
public class StartupParameters {
  public static final String CONFIG_PARAMETER = "config";

  private final MapConfiguration parameters;

  public StartupParameters(String[] args) {
    Map<String, Object> values = new LinkedHashMap<>();
    if (args != null) {
      for (String arg : args) {
        if (arg == null || arg.isBlank()) continue;
        if (!arg.startsWith("--")) {
          throw new IllegalArgumentException(
              "Unsupported argument '" + arg + "', expected --name=value");
        }
        String body = arg.substring(2);
        int eq = body.indexOf('=');
        if (eq < 0) {
          values.put(body, "true");
        } else {
          values.put(body.substring(0, eq), body.substring(eq + 1));
        }
      }
    }
    this.parameters = new MapConfiguration(values);
    this.parameters.setListDelimiterHandler(new DisabledListDelimiterHandler());
  }

  public <T> T getParameter(String name, Class<T> type) {
    return parameters.get(type, name, null);
  }

  public <T> T getParameter(String name, Class<T> type, T defaultValue) {
    return parameters.get(type, name, defaultValue);
  }

  /** Path given with {@code --config}, or {@code null} to use the bundled application.yaml. */
  public String configFile() {
    return getParameter(CONFIG_PARAMETER, String.class);
  }
}
