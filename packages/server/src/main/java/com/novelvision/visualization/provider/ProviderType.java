package com.novelvision.visualization.provider;

import com.novelvision.visualization.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/** Closed set of image generation backends the orchestrator knows about. */
public enum ProviderType {
  DALLE3("dalle3", "DALL-E 3", 4000, false, 15),
  MIDJOURNEY("midjourney", "Midjourney", 6000, true, 60),
  STABLE_DIFFUSION("stable-diffusion", "Stable Diffusion", 380, true, 10),
  FLUX("flux", "Flux", 1000, true, 20);

  private final String apiName;
  private final String displayName;
  private final int maxPromptLength;
  private final boolean supportsNegativePrompt;
  private final int averageGenerationSeconds;

  ProviderType(
      String apiName,
      String displayName,
      int maxPromptLength,
      boolean supportsNegativePrompt,
      int averageGenerationSeconds) {
    this.apiName = apiName;
    this.displayName = displayName;
    this.maxPromptLength = maxPromptLength;
    this.supportsNegativePrompt = supportsNegativePrompt;
    this.averageGenerationSeconds = averageGenerationSeconds;
  }

  /** Key used in configuration and requests, e.g. {@code stable-diffusion}. */
  public String apiName() {
    return apiName;
  }

  public String displayName() {
    return displayName;
  }

  public int maxPromptLength() {
    return maxPromptLength;
  }

  public boolean supportsNegativePrompt() {
    return supportsNegativePrompt;
  }

  public int averageGenerationSeconds() {
    return averageGenerationSeconds;
  }

  public static Optional<ProviderType> fromApiName(String value) {
    if (value == null || value.isBlank()) return Optional.empty();
    String v = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(p -> p.apiName.equals(v) || p.name().equalsIgnoreCase(v))
        .findFirst();
  }

  /**
   * Parse a caller-supplied provider name. Blank means "no preference".
   *
   * @throws ValidationException for names outside the known set
   */
  public static ProviderType parse(String value) {
    if (value == null || value.isBlank()) return null;
    return fromApiName(value)
        .orElseThrow(
            () ->
                new ValidationException(
                    "Unknown provider '"
                        + value
                        + "', expected one of "
                        + Arrays.stream(values())
                            .map(ProviderType::apiName)
                            .collect(Collectors.joining(", "))));
  }
}
