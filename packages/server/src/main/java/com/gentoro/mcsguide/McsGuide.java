package com.gentoro.mcsguide;

import com.gentoro.mcsguide.actuator.HealthService;
import com.gentoro.mcsguide.content.ContentLoader;
import com.gentoro.mcsguide.content.ContentStore;
import com.gentoro.mcsguide.exception.DataLoadException;
import com.gentoro.mcsguide.exception.NetworkException;
import com.gentoro.mcsguide.exception.StateException;
import com.gentoro.mcsguide.http.EmbeddedJettyServer;
import com.gentoro.mcsguide.http.filter.ApiKeyAuthenticator;
import com.gentoro.mcsguide.http.filter.RequestNormalizationFilter;
import com.gentoro.mcsguide.mcp.McpServer;
import com.gentoro.mcsguide.openapi.OpenApiDocumentGenerator;
import com.gentoro.mcsguide.openapi.OpenApiService;
import com.gentoro.mcsguide.registry.KnowledgeOperations;
import com.gentoro.mcsguide.registry.OperationRegistry;
import com.gentoro.mcsguide.rest.RestApiService;
import com.gentoro.mcsguide.search.SearchEngine;
import jakarta.servlet.DispatcherType;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.FilterHolder;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;

public class McsGuide {

  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(McsGuide.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ContentStore contentStore;
  private SearchEngine searchEngine;
  private OperationRegistry operationRegistry;
  private ApiKeyAuthenticator authenticator;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public McsGuide(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.mcsguide.logging.LoggingService.applyConfiguration(configuration());

    try {
      this.contentStore =
          new ContentLoader(configuration().getString("data.location", "classpath:data")).load();
    } catch (DataLoadException e) {
      throw e;
    } catch (Exception e) {
      throw new DataLoadException("Failed to load the knowledge base", Map.of(), e);
    }
    this.searchEngine = new SearchEngine(contentStore);
    this.operationRegistry = KnowledgeOperations.createRegistry(searchEngine);
    log.debug("Registered {} operations", operationRegistry.all().size());

    this.authenticator =
        ApiKeyAuthenticator.fromKeyList(
            configuration().getString("auth.header", ApiKeyAuthenticator.DEFAULT_HEADER),
            configuration().getString("auth.api-keys", ""));
    if (authenticator.keyCount() == 0) {
      log.warn("No API keys configured (auth.api-keys); every protected request will get 401");
    }

    // Initialize shared Jetty server and register components
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();

    try {
      ServletContextHandler context = httpServer.getContextHandler();
      String healthPath = configuration().getString("http.health.path", "/health");
      String basePath = configuration().getString("http.api.base-path", "/api/v1");
      String serverName = McpServer.serverName(configuration());
      String serverVersion = configuration().getString("http.mcp.server.version", "1.0.0");

      FilterHolder filter =
          new FilterHolder(
              RequestNormalizationFilter.standard(
                  McpServer.endpoint(configuration()), serverName, healthPath, authenticator));
      filter.setAsyncSupported(true);
      context.addFilter(filter, "/*", EnumSet.of(DispatcherType.REQUEST));

      // Register actuator health endpoint
      new HealthService(contentStore, healthPath).register(context);
      // Register knowledge base REST API
      RestApiService restApi = new RestApiService(operationRegistry, basePath);
      restApi.register(context);
      // Register capability description
      new OpenApiService(
              new OpenApiDocumentGenerator(
                  operationRegistry,
                  restApi.basePath(),
                  authenticator.headerName(),
                  serverName,
                  serverVersion))
          .register(context);
      // Register MCP servlet
      this.mcpServer = new McpServer(configuration(), operationRegistry, contentStore);
      mcpServer.register(context);

      // Start Jetty (non-blocking)
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
    log.info("MCS guide ready on port {}", httpServer.getPort());
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    // Register a JVM shutdown hook once
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "mcs-guide-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    // Wait until shutdown is triggered
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while releasing {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("McsGuide not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ContentStore contentStore() {
    return contentStore;
  }

  public SearchEngine searchEngine() {
    return searchEngine;
  }

  public OperationRegistry operationRegistry() {
    return operationRegistry;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
