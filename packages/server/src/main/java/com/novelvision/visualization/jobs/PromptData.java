package com.novelvision.visualization.jobs;

/** Result of the prompt stage, stored on the job before the provider is called. */
public record PromptData(
    String originalText,
    String enhancedPrompt,
    String negativePrompt,
    String style,
    String targetModel) {}
