package com.gentoro.mcsguide;

public class McsGuideApp {

  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(McsGuideApp.class);

  static final String USAGE =
      """
      Usage: mcs-guide [--config-file <location>] [--mode server|help]

        --config-file  YAML configuration: classpath:<resource>, file:<uri> or a path
                       (default classpath:application.yaml)
        --mode         server (default) starts the HTTP server, help prints this text

      Environment: PORT (listen port, default 2011), API_KEYS (comma separated keys)
      """;

  public static void main(String[] args) {
    McsGuide app;
    try {
      app = new McsGuide(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.print(USAGE);
      System.exit(2);
      return;
    }
    if (app.startupParameters().isHelpRequested()) {
      System.out.print(USAGE);
      return;
    }

    try {
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      app.shutdown();
      System.exit(1);
      return;
    }
    app.waitShutdownSignal();
  }
}
