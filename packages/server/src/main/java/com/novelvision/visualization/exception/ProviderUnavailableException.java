package com.novelvision.visualization.exception;

/** The provider is unknown, disabled or not configured. */
public class ProviderUnavailableException extends ProviderException {
  public ProviderUnavailableException(String provider, String message) {
    super(VisualizationErrorCode.PROVIDER_UNAVAILABLE, provider, message, null);
  }

  public ProviderUnavailableException(String provider, String message, Throwable cause) {
    super(VisualizationErrorCode.PROVIDER_UNAVAILABLE, provider, message, cause);
  }
}
