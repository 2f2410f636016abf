package com.novelvision.visualization.jobs;

/**
 * A span of text picked by a reader. Surrounding context is clipped to {@value #MAX_CONTEXT_LENGTH}
 * characters on each side, keeping the characters nearest to the selection.
 */
public record TextSelection(
    String selectedText,
    int startOffset,
    int endOffset,
    String contextBefore,
    String contextAfter) {

  public static final int MAX_CONTEXT_LENGTH = 200;
  public static final int MIN_SELECTION_LENGTH = 10;
  public static final int MAX_SELECTION_LENGTH = 5000;

  public TextSelection {
    contextBefore = clipTail(contextBefore);
    contextAfter = clipHead(contextAfter);
  }

  /** Text handed to prompt synthesis: the selection with its surrounding context. */
  public String fullContext() {
    return contextBefore + (selectedText == null ? "" : selectedText) + contextAfter;
  }

  private static String clipTail(String value) {
    if (value == null) return "";
    return value.length() <= MAX_CONTEXT_LENGTH
        ? value
        : value.substring(value.length() - MAX_CONTEXT_LENGTH);
  }

  private static String clipHead(String value) {
    if (value == null) return "";
    return value.length() <= MAX_CONTEXT_LENGTH ? value : value.substring(0, MAX_CONTEXT_LENGTH);
  }
}
