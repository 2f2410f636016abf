package com.novelvision.visualization.exception;

/** The operation is not legal for the job's current status. */
public class InvalidStateException extends VisualizationException {
  public InvalidStateException(String message) {
    super(VisualizationErrorCode.INVALID_STATE, message);
  }

  public InvalidStateException(String message, Throwable cause) {
    super(VisualizationErrorCode.INVALID_STATE, message, cause);
  }
}
