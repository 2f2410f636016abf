package com.novelvision.visualization.exception;

/** Stable error codes shared by every {@link VisualizationException}. */
public enum VisualizationErrorCode {
  UNKNOWN,
  VALIDATION_ERROR,
  INVALID_TARGET,
  NOT_FOUND,
  FORBIDDEN,
  ALREADY_IN_PROGRESS,
  INVALID_STATE,
  TRANSIENT_ERROR,
  PERMANENT_ERROR,
  PROVIDER_UNAVAILABLE,
  RETRY_LIMIT_EXCEEDED,
  STATE_ERROR,
  CONFIGURATION_ERROR;

  /** Whether a pipeline failure carrying this code may be retried automatically. */
  public boolean isAutoRetryable() {
    return this == TRANSIENT_ERROR;
  }
}
