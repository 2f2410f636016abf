package com.novelvision.visualization.exception;

/** The caller neither owns the job nor holds administrative rights. */
public class ForbiddenException extends VisualizationException {
  public ForbiddenException(String message) {
    super(VisualizationErrorCode.FORBIDDEN, message);
  }

  public ForbiddenException(String message, Throwable cause) {
    super(VisualizationErrorCode.FORBIDDEN, message, cause);
  }
}
