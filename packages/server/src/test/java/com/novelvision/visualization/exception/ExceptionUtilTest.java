package com.novelvision.visualization.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("Provider failures deep in the cause chain keep their provider tag")
  void providerMessageWinsInCauseChain() {
    Exception wrapped =
        new VisualizationException(
            VisualizationErrorCode.UNKNOWN,
            "Pipeline failed",
            new TransientProviderException("dalle3", "HTTP 503"));

    assertEquals("[dalle3] HTTP 503", ExceptionUtil.extractErrorMessage(wrapped));
  }

  @Test
  void plainExceptionsAreQualifiedByType() {
    assertEquals(
        "IOException: disk full", ExceptionUtil.extractErrorMessage(new IOException("disk full")));
    assertEquals(
        "IllegalStateException",
        ExceptionUtil.extractErrorMessage(new IllegalStateException()));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  void visualizationMessagesAreKeptAsIs() {
    assertEquals(
        "Page p-1 not found",
        ExceptionUtil.extractErrorMessage(new NotFoundException("Page p-1 not found")));
  }

  @Test
  void unknownThrowablesMapToUnknownCode() {
    assertEquals(VisualizationErrorCode.UNKNOWN, ExceptionUtil.codeOf(new RuntimeException()));
    assertEquals(
        VisualizationErrorCode.PERMANENT_ERROR,
        ExceptionUtil.codeOf(new PermanentProviderException("flux", "Prompt rejected")));
  }

  @Test
  @DisplayName("whereThrown keeps the innermost frames with simple class names")
  void whereThrownIsLimited() {
    String trace = ExceptionUtil.whereThrown(new Exception("x"), 2);

    assertEquals(2, trace.split(" > ").length);
    assertTrue(trace.startsWith("ExceptionUtilTest.whereThrownIsLimited:"), trace);
    assertEquals("", ExceptionUtil.whereThrown(new Exception("x"), 0));
    assertEquals("", ExceptionUtil.whereThrown(null, 3));
  }
}
