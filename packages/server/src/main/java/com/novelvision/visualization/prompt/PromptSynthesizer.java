package com.novelvision.visualization.prompt;

import com.novelvision.visualization.provider.ProviderType;

/**
 * Turns raw book text into a generation-ready prompt.
 *
 * <p>Failures are raised as {@link com.novelvision.visualization.exception.VisualizationException}
 * with code {@code TRANSIENT_ERROR}: a failed synthesis is always worth retrying.
 */
public interface PromptSynthesizer {

  /**
   * @param bookId book the text belongs to, lets the synthesizer keep characters consistent
   * @param sourceText page content or selected text with its context
   * @param style optional style hint, e.g. {@code watercolor}
   * @param targetModel provider the prompt is written for
   */
  PromptResult enhance(String bookId, String sourceText, String style, ProviderType targetModel);
}
