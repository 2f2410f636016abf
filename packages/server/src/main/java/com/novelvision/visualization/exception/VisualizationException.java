package com.novelvision.visualization.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for the visualization service. Every failure surfaced to callers or
 * recorded on a job carries a {@link VisualizationErrorCode} and an optional context map.
 */
public class VisualizationException extends RuntimeException {
  private final VisualizationErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public VisualizationException(VisualizationErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public VisualizationException(VisualizationErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public VisualizationErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value pair and return this exception for chaining. */
  public VisualizationException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }
}
