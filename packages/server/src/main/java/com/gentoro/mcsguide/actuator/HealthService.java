package com.gentoro.mcsguide.actuator;

import com.gentoro.mcsguide.content.ContentKind;
import com.gentoro.mcsguide.content.ContentStore;
import com.gentoro.mcsguide.http.JsonResponses;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Liveness endpoint, reachable without credentials.
 *
 * <p>Response body: {"status":"healthy","data_loaded":true,"counts":{"best_practices":12,...}}
 */
public class HealthService {
  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(HealthService.class);

  private final ContentStore store;
  private final String path;

  public HealthService(ContentStore store, String path) {
    this.store = store;
    this.path = path;
  }

  public void register(ServletContextHandler context) {
    context.addServlet(new ServletHolder(new HealthServlet()), path);
    log.info("Health endpoint registered at {}", path);
  }

  Map<String, Object> payload() {
    Map<String, Object> counts = new LinkedHashMap<>();
    for (ContentKind kind : ContentKind.values()) {
      counts.put(kind.fileName().replace(".json", ""), store.count(kind));
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "healthy");
    body.put("data_loaded", !store.isEmpty());
    body.put("counts", counts);
    return body;
  }

  private class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      JsonResponses.send(resp, HttpServletResponse.SC_OK, payload());
    }
  }
}
