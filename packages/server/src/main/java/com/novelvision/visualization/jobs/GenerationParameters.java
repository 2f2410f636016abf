package com.novelvision.visualization.jobs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied generation settings. Only {@link #size()} is interpreted by the orchestrator;
 * everything else, {@link #extra()} included, is passed through to the provider adapter.
 */
public record GenerationParameters(
    String size,
    String quality,
    String style,
    String aspectRatio,
    Long seed,
    Integer steps,
    Double cfgScale,
    String sampler,
    boolean upscale,
    Map<String, Object> extra) {

  public static final String DEFAULT_SIZE = "1024x1024";
  public static final String DEFAULT_QUALITY = "standard";
  public static final String DEFAULT_ASPECT_RATIO = "1:1";

  public GenerationParameters {
    size = blankToNull(size) == null ? DEFAULT_SIZE : size.trim();
    quality = blankToNull(quality) == null ? DEFAULT_QUALITY : quality.trim();
    aspectRatio = blankToNull(aspectRatio) == null ? DEFAULT_ASPECT_RATIO : aspectRatio.trim();
    extra =
        extra == null || extra.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  public static GenerationParameters defaults() {
    return new GenerationParameters(null, null, null, null, null, null, null, null, false, null);
  }

  /** Width parsed from {@code WIDTHxHEIGHT}; falls back to 1024 for unparseable sizes. */
  public int width() {
    return dimension(0);
  }

  public int height() {
    return dimension(1);
  }

  public GenerationParameters withStyle(String newStyle) {
    return new GenerationParameters(
        size, quality, newStyle, aspectRatio, seed, steps, cfgScale, sampler, upscale, extra);
  }

  private int dimension(int index) {
    String[] parts = size.toLowerCase().split("x");
    if (parts.length != 2) return 1024;
    try {
      return Integer.parseInt(parts[index].trim());
    } catch (NumberFormatException e) {
      return 1024;
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
