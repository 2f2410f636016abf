package com.novelvision.visualization.prompt;

import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import org.apache.commons.configuration2.Configuration;

/** Selects the synthesizer from {@code prompt.mode}: {@code remote} (default) or {@code local}. */
public final class PromptSynthesizerFactory {
  private PromptSynthesizerFactory() {}

  public static PromptSynthesizer create(Configuration configuration) {
    Configuration prompt = configuration.subset("prompt");
    String mode = prompt.getString("mode", "remote");
    switch (mode.toLowerCase()) {
      case "remote":
        return new HttpPromptSynthesizer(prompt);
      case "local":
        return new TemplatePromptSynthesizer();
      default:
        throw new VisualizationException(
            VisualizationErrorCode.CONFIGURATION_ERROR, "Unknown prompt.mode '" + mode + "'");
    }
  }
}
