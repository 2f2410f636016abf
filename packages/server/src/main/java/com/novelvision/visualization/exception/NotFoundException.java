package com.novelvision.visualization.exception;

/** A referenced job or image does not exist. */
public class NotFoundException extends VisualizationException {
  public NotFoundException(String message) {
    super(VisualizationErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(VisualizationErrorCode.NOT_FOUND, message, cause);
  }
}
