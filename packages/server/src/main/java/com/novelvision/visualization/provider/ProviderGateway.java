package com.novelvision.visualization.provider;

import com.novelvision.visualization.exception.ExceptionUtil;
import com.novelvision.visualization.exception.PermanentProviderException;
import com.novelvision.visualization.exception.ProviderException;
import com.novelvision.visualization.exception.ProviderUnavailableException;
import com.novelvision.visualization.jobs.GenerationParameters;
import com.novelvision.visualization.logging.LoggingService;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Uniform entry point over the registered {@link ImageProvider} adapters. Adding a backend means
 * registering one more adapter; callers never switch on the provider.
 */
public class ProviderGateway {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ProviderGateway.class);

  private final Map<ProviderType, ImageProvider> providers = new EnumMap<>(ProviderType.class);
  private final ProviderType defaultProvider;

  public ProviderGateway(ProviderType defaultProvider) {
    this.defaultProvider = defaultProvider;
  }

  public ProviderGateway register(ImageProvider provider) {
    providers.put(provider.type(), provider);
    log.info("Registered image provider {}", provider.type().displayName());
    return this;
  }

  public ProviderType defaultProvider() {
    return defaultProvider;
  }

  public Set<ProviderType> availableProviders() {
    return Collections.unmodifiableSet(providers.keySet());
  }

  public boolean isAvailable(ProviderType type) {
    return type != null && providers.containsKey(type);
  }

  /** Provider used for a job: its preference, else the configured default. */
  public ProviderType resolve(ProviderType preferred) {
    return preferred != null ? preferred : defaultProvider;
  }

  /**
   * Generate images with {@code provider} (or the default when {@code null}).
   *
   * @throws ProviderUnavailableException when no adapter is registered for the provider
   * @throws ProviderException for transient or permanent provider failures
   */
  public ImageResult generate(
      String prompt,
      String negativePrompt,
      GenerationParameters parameters,
      ProviderType provider) {
    ProviderType target = resolve(provider);
    if (target == null) {
      throw new ProviderUnavailableException("unknown", "No provider selected and no default set");
    }
    ImageProvider adapter = providers.get(target);
    if (adapter == null) {
      throw new ProviderUnavailableException(
          target.apiName(), target.displayName() + " is not available");
    }
    ImageRequest request = ImageRequest.forProvider(target, prompt, negativePrompt, parameters);
    try {
      return adapter.generate(request);
    } catch (ProviderException e) {
      log.warn("Provider call failed: {}", e.taggedMessage());
      throw e;
    } catch (RuntimeException e) {
      log.error("Adapter {} failed unexpectedly", target.apiName(), e);
      throw new PermanentProviderException(
          target.apiName(), ExceptionUtil.extractErrorMessage(e), e);
    }
  }
}
