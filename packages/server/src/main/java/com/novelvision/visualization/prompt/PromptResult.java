package com.novelvision.visualization.prompt;

import java.util.List;

/** Output of prompt synthesis. */
public record PromptResult(
    String enhancedPrompt,
    String negativePrompt,
    String style,
    String targetModel,
    String sceneDescription,
    List<String> characters) {

  public PromptResult {
    characters = characters == null ? List.of() : List.copyOf(characters);
  }
}
