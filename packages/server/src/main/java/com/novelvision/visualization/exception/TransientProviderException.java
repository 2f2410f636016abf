package com.novelvision.visualization.exception;

/** Network failure, timeout, rate limit or server error. Eligible for retry. */
public class TransientProviderException extends ProviderException {
  public TransientProviderException(String provider, String message) {
    super(VisualizationErrorCode.TRANSIENT_ERROR, provider, message, null);
  }

  public TransientProviderException(String provider, String message, Throwable cause) {
    super(VisualizationErrorCode.TRANSIENT_ERROR, provider, message, cause);
  }
}
