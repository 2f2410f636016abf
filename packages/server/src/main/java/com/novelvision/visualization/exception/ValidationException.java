package com.novelvision.visualization.exception;

/** Invalid input supplied by a caller. Never retried. */
public class ValidationException extends VisualizationException {
  public ValidationException(String message) {
    super(VisualizationErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(VisualizationErrorCode.VALIDATION_ERROR, message, cause);
  }
}
