package com.gentoro.mcsguide.openapi;

import io.swagger.v3.core.util.Json;
import io.swagger.v3.oas.models.OpenAPI;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Serves the generated OpenAPI document at {@code /openapi.json}. */
public class OpenApiService {
  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(OpenApiService.class);

  public static final String PATH = "/openapi.json";

  private final String document;

  public OpenApiService(OpenApiDocumentGenerator generator) {
    OpenAPI openApi = generator.generate();
    this.document = Json.pretty(openApi);
    log.debug("OpenAPI document generated with {} paths", openApi.getPaths().size());
  }

  public void register(ServletContextHandler context) {
    context.addServlet(new ServletHolder(new DocumentServlet()), PATH);
    log.info("OpenAPI document registered at {}", PATH);
  }

  String document() {
    return document;
  }

  private class DocumentServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(HttpServletResponse.SC_OK);
      resp.setContentType("application/json");
      resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
      resp.getWriter().write(document);
    }
  }
}
