package com.novelvision.visualization.provider;

/**
 * Adapter over one image generation backend.
 *
 * <p>Failures are reported through the provider exception taxonomy: {@link
 * com.novelvision.visualization.exception.TransientProviderException} for network errors,
 * timeouts, rate limiting and server errors, {@link
 * com.novelvision.visualization.exception.PermanentProviderException} when the backend rejects the
 * request.
 */
public interface ImageProvider {
  ProviderType type();

  ImageResult generate(ImageRequest request);
}
