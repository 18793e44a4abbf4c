package com.gentoro.mcsguide.rest;

import com.gentoro.mcsguide.exception.ExceptionUtil;
import com.gentoro.mcsguide.exception.NotFoundException;
import com.gentoro.mcsguide.exception.ValidationException;
import com.gentoro.mcsguide.http.JsonResponses;
import com.gentoro.mcsguide.registry.Operation;
import com.gentoro.mcsguide.registry.OperationParameter;
import com.gentoro.mcsguide.registry.OperationRegistry;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Read-only REST API over the knowledge base. One servlet is mounted at {@code <base-path>/*}; it
 * resolves each request path to a REST operation of the {@link OperationRegistry}, binds path and
 * query parameters, and writes the operation's result as JSON.
 *
 * <p>Unknown records and unknown paths answer 404, a missing required parameter 400, any other
 * method than GET 405. All error bodies are {@code {"detail": "..."}}.
 */
public class RestApiService {
  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(RestApiService.class);

  private final OperationRegistry registry;
  private final String basePath;

  public RestApiService(OperationRegistry registry, String basePath) {
    this.registry = registry;
    this.basePath = normalizeBasePath(basePath);
  }

  public void register(ServletContextHandler context) {
    context.addServlet(new ServletHolder(new ApiServlet()), basePath + "/*");
    log.info(
        "REST API registered under {}/* ({} operations)",
        basePath,
        registry.operations(Operation.Surface.REST).size());
  }

  public String basePath() {
    return basePath;
  }

  static String normalizeBasePath(String path) {
    if (path == null || path.isBlank()) return "/api/v1";
    String p = path.trim();
    if (!p.startsWith("/")) p = "/" + p;
    while (p.endsWith("/") && p.length() > 1) p = p.substring(0, p.length() - 1);
    return p;
  }

  private class ApiServlet extends HttpServlet {

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String method = req.getMethod();
      if (!"GET".equalsIgnoreCase(method)) {
        resp.setHeader("Allow", "GET, OPTIONS");
        JsonResponses.sendError(
            resp, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "Method not allowed");
        return;
      }
      handleGet(req, resp);
    }

    private void handleGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String path = req.getPathInfo() == null ? "/" : req.getPathInfo();
      Optional<OperationRegistry.Route> route = registry.route(path);
      if (route.isEmpty()) {
        JsonResponses.sendError(resp, HttpServletResponse.SC_NOT_FOUND, "Not found");
        return;
      }

      Operation op = route.get().operation();
      Map<String, String> arguments = new LinkedHashMap<>(route.get().pathParameters());
      for (OperationParameter parameter : op.parameters()) {
        if (parameter.location() == OperationParameter.Location.QUERY) {
          String value = req.getParameter(parameter.name());
          if (value != null) {
            arguments.put(parameter.name(), value);
          }
        }
      }

      try {
        Object result = registry.invoke(op.name(), arguments);
        JsonResponses.send(resp, HttpServletResponse.SC_OK, result);
      } catch (NotFoundException e) {
        JsonResponses.sendError(resp, HttpServletResponse.SC_NOT_FOUND, e.getMessage());
      } catch (ValidationException e) {
        JsonResponses.sendError(resp, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
      } catch (RuntimeException e) {
        log.error(
            "Operation {} failed: {}", op.name(), ExceptionUtil.toErrorDetails(e).message, e);
        JsonResponses.sendError(
            resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Internal server error");
      }
    }
  }
}
