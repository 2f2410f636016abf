package com.novelvision.visualization.exception;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Turns failures into the short messages and codes stored on jobs and written to logs. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Top {@code frames} stack frames of {@code t} as {@code Class.method:line}, innermost first,
   * joined by {@code " > "}. Meant for one-line log entries next to a job error message.
   */
  public static String whereThrown(Throwable t, int frames) {
    if (t == null) return "";
    return Arrays.stream(t.getStackTrace())
        .limit(Math.max(frames, 0))
        .map(f -> simpleName(f.getClassName()) + '.' + f.getMethodName() + ':' + f.getLineNumber())
        .collect(Collectors.joining(" > "));
  }

  private static String simpleName(String className) {
    return className.substring(className.lastIndexOf('.') + 1);
  }

  /**
   * Message stored on a failed job. A provider failure anywhere in the cause chain gives its
   * tagged message; otherwise the top-level message, prefixed with the exception type unless it is
   * one of ours.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    Throwable current = t;
    while (current != null) {
      if (current instanceof ProviderException pe) {
        return pe.taggedMessage();
      }
      current = current.getCause();
    }

    if (t instanceof VisualizationException
        && t.getMessage() != null
        && !t.getMessage().isBlank()) {
      return t.getMessage();
    }

    String className = t.getClass().getSimpleName();
    String message = t.getMessage();
    if (message == null || message.isBlank()) {
      return className;
    }
    return className + ": " + message;
  }

  /** Error code of a throwable, or {@link VisualizationErrorCode#UNKNOWN}. */
  public static VisualizationErrorCode codeOf(Throwable t) {
    return t instanceof VisualizationException ex ? ex.getCode() : VisualizationErrorCode.UNKNOWN;
  }
}
