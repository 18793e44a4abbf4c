package com.gentoro.mcsguide.http;

import com.gentoro.mcsguide.exception.ConfigException;
import com.gentoro.mcsguide.exception.ExceptionUtil;
import com.gentoro.mcsguide.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop) and exposes the {@link
 * ServletContextHandler} so that the REST, MCP and health components can register their servlets
 * and the request normalization filter.
 *
 * <p>Configuration keys: {@code http.hostname} (default 0.0.0.0) and {@code http.port} (default
 * 2011; 0 binds an ephemeral port).
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  static final int DEFAULT_PORT = 2011;

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port = configuredPort();
      String hostname;
      try {
        hostname = configuration.getString("http.hostname", "0.0.0.0");
        if (hostname == null || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
        log.trace("Jetty prepared for {}:{}", hostname, port);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize jetty service. "
                + "Please, check if the chosen port and hostname are available",
            e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "There was a problem while attempting to start jetty service. "
                        + "Please, check if the chosen port and hostname are available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server != null) {
        try {
          if (server.isRunning() || server.isStarting()) {
            server.stop();
          }
        } catch (Exception e) {
          // Logged, not rethrown, so the remaining components still get to shut down
          log.error("Error stopping jetty server", e);
        } finally {
          server = null;
          contextHandler = null;
        }
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** The bound port once started, the configured one before. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        for (Connector connector : server.getConnectors()) {
          if (connector instanceof ServerConnector sc) {
            return sc.getLocalPort();
          }
        }
      }
      return configuredPort();
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  private int configuredPort() {
    String raw = configuration.getString("http.port", null);
    if (raw == null || raw.isBlank()) {
      return DEFAULT_PORT;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid http.port configuration: " + raw, e);
    }
  }

  @Override
  public void close() {
    stop();
  }
}
