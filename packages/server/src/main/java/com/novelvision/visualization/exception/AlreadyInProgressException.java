package com.novelvision.visualization.exception;

/** A non-terminal job already targets the same content. */
public class AlreadyInProgressException extends VisualizationException {
  public AlreadyInProgressException(String message) {
    super(VisualizationErrorCode.ALREADY_IN_PROGRESS, message);
  }

  public AlreadyInProgressException(String message, Throwable cause) {
    super(VisualizationErrorCode.ALREADY_IN_PROGRESS, message, cause);
  }
}
