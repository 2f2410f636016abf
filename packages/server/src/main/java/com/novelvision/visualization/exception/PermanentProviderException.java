package com.novelvision.visualization.exception;

/** The provider rejected the request. Not retried automatically. */
public class PermanentProviderException extends ProviderException {
  public PermanentProviderException(String provider, String message) {
    super(VisualizationErrorCode.PERMANENT_ERROR, provider, message, null);
  }

  public PermanentProviderException(String provider, String message, Throwable cause) {
    super(VisualizationErrorCode.PERMANENT_ERROR, provider, message, cause);
  }
}
