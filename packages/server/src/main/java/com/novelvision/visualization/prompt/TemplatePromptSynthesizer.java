package com.novelvision.visualization.prompt;

import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.provider.ProviderType;
import org.apache.commons.lang3.StringUtils;

/** Local synthesizer that builds the prompt from a template, with no remote call. */
public class TemplatePromptSynthesizer implements PromptSynthesizer {
  static final String DEFAULT_NEGATIVE_PROMPT =
      "text, watermark, signature, blurry, low quality, distorted";
  static final int MAX_SCENE_LENGTH = 1200;

  @Override
  public PromptResult enhance(
      String bookId, String sourceText, String style, ProviderType targetModel) {
    String scene = StringUtils.normalizeSpace(sourceText);
    if (StringUtils.isBlank(scene)) {
      throw new VisualizationException(
          VisualizationErrorCode.TRANSIENT_ERROR, "No source text to build a prompt from");
    }
    scene = StringUtils.abbreviate(scene, MAX_SCENE_LENGTH);
    String styleClause =
        StringUtils.isBlank(style) ? "detailed digital painting" : style.trim() + " style";
    String prompt = "Book illustration, " + styleClause + ". Scene: " + scene;
    return new PromptResult(
        prompt, DEFAULT_NEGATIVE_PROMPT, style, targetModel.apiName(), scene, null);
  }
}
