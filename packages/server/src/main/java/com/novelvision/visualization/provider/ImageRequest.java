package com.novelvision.visualization.provider;

import com.novelvision.visualization.jobs.GenerationParameters;

/** Provider-ready request: prompt already fitted to the target provider's limits. */
public record ImageRequest(
    ProviderType provider,
    String prompt,
    String negativePrompt,
    GenerationParameters parameters) {

  /**
   * Fit a prompt to {@code provider}. Providers without negative prompt support get the negative
   * prompt folded into the main one as {@code "<prompt>. Avoid: <negative>"}; the result is cut to
   * the provider's maximum prompt length.
   */
  public static ImageRequest forProvider(
      ProviderType provider,
      String prompt,
      String negativePrompt,
      GenerationParameters parameters) {
    String text = prompt == null ? "" : prompt.trim();
    String negative = negativePrompt == null || negativePrompt.isBlank() ? null : negativePrompt;
    if (negative != null && !provider.supportsNegativePrompt()) {
      text = text + ". Avoid: " + negative;
      negative = null;
    }
    if (text.length() > provider.maxPromptLength()) {
      text = text.substring(0, provider.maxPromptLength());
    }
    GenerationParameters effective =
        parameters == null ? GenerationParameters.defaults() : parameters;
    return new ImageRequest(provider, text, negative, effective);
  }
}
