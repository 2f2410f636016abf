package com.novelvision.visualization;

import com.novelvision.visualization.logging.LoggingService;

public class VisualizationServiceApp {

  private static final org.slf4j.Logger log =
      LoggingService.getLogger(VisualizationServiceApp.class);

  public static void main(String[] args) {
    try {
      VisualizationService app = new VisualizationService(args);
      app.initialize();
      // Keep the workers running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
