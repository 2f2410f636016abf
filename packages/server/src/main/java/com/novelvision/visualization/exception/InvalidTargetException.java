package com.novelvision.visualization.exception;

/** The referenced book or page does not exist or is not eligible for visualization. */
public class InvalidTargetException extends VisualizationException {
  public InvalidTargetException(String message) {
    super(VisualizationErrorCode.INVALID_TARGET, message);
  }

  public InvalidTargetException(String message, Throwable cause) {
    super(VisualizationErrorCode.INVALID_TARGET, message, cause);
  }
}
