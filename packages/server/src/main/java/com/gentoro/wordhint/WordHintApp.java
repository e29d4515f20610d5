package com.gentoro.wordhint;

import com.gentoro.wordhint.logging.LoggingService;

public class WordHintApp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(WordHintApp.class);

  public static void main(String[] args) {
    try {
      WordHint app = new WordHint(args);
      app.initialize();
      // Keep the server running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
