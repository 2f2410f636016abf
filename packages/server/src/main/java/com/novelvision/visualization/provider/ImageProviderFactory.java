package com.novelvision.visualization.provider;

import com.novelvision.visualization.exception.ProviderUnavailableException;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.logging.LoggingService;
import org.apache.commons.configuration2.Configuration;

/**
 * Builds the {@link ProviderGateway} from {@code providers.*} configuration. Providers are opt-in
 * through {@code providers.<apiName>.enabled}; an enabled provider whose adapter cannot be built
 * (missing credentials, no adapter) is logged and left unregistered, so jobs targeting it fail with
 * {@code ProviderUnavailable}.
 */
public final class ImageProviderFactory {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ImageProviderFactory.class);

  private ImageProviderFactory() {}

  public static ProviderGateway createGateway(Configuration configuration) {
    Configuration providers = configuration.subset("providers");
    String defaultName = providers.getString("default", ProviderType.DALLE3.apiName());
    ProviderType defaultProvider =
        ProviderType.fromApiName(defaultName)
            .orElseThrow(
                () ->
                    new VisualizationException(
                        VisualizationErrorCode.CONFIGURATION_ERROR,
                        "Unknown default provider '" + defaultName + "'"));
    long defaultTimeout = providers.getLong("timeout-seconds", 60L);

    ProviderGateway gateway = new ProviderGateway(defaultProvider);
    for (ProviderType type : ProviderType.values()) {
      Configuration own = providers.subset(type.apiName());
      if (!own.getBoolean("enabled", false)) {
        continue;
      }
      try {
        gateway.register(create(type, own, defaultTimeout));
      } catch (ProviderUnavailableException e) {
        log.warn("Provider {} enabled but unavailable: {}", type.apiName(), e.getMessage());
      }
    }
    if (!gateway.isAvailable(defaultProvider)) {
      log.warn("Default provider {} is not available", defaultProvider.apiName());
    }
    return gateway;
  }

  static ImageProvider create(ProviderType type, Configuration configuration, long timeout) {
    switch (type) {
      case DALLE3:
        return new OpenAiImageProvider(configuration, timeout);
      case STABLE_DIFFUSION:
        return new StableDiffusionImageProvider(configuration, timeout);
      case FLUX:
        return new FluxImageProvider(configuration, timeout);
      case MIDJOURNEY:
      default:
        throw new ProviderUnavailableException(
            type.apiName(), type.displayName() + " has no adapter");
    }
  }
}
