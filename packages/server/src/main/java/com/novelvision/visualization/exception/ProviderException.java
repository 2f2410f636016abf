package com.novelvision.visualization.exception;

/**
 * Failure reported by an image-generation provider, normalized by the provider gateway. The
 * provider api name is kept so job error messages can be tagged with it.
 */
public abstract class ProviderException extends VisualizationException {
  private final String provider;

  protected ProviderException(
      VisualizationErrorCode code, String provider, String message, Throwable cause) {
    super(code, message, cause);
    this.provider = provider;
    withContext("provider", provider);
  }

  public String getProvider() {
    return provider;
  }

  /** Message prefixed with the provider name, e.g. {@code [dalle3] HTTP 500}. */
  public String taggedMessage() {
    return "[%s] %s".formatted(provider == null ? "unknown" : provider, getMessage());
  }
}
