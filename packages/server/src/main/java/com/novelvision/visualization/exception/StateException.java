package com.novelvision.visualization.exception;

/** Misuse of a service component, e.g. access before initialization. */
public class StateException extends VisualizationException {
  public StateException(String message) {
    super(VisualizationErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(VisualizationErrorCode.STATE_ERROR, message, cause);
  }
}
