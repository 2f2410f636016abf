package com.novelvision.visualization.exception;

/** The job has exhausted its retry budget. */
public class RetryLimitExceededException extends VisualizationException {
  public RetryLimitExceededException(String message) {
    super(VisualizationErrorCode.RETRY_LIMIT_EXCEEDED, message);
  }

  public RetryLimitExceededException(String message, Throwable cause) {
    super(VisualizationErrorCode.RETRY_LIMIT_EXCEEDED, message, cause);
  }
}
