package com.gentoro.mcsguide.http;

import com.gentoro.mcsguide.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Writes JSON bodies for the plain HTTP endpoints. */
public final class JsonResponses {
  public static final String APPLICATION_JSON = "application/json";

  private JsonResponses() {}

  public static void send(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType(APPLICATION_JSON);
    resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
    try (PrintWriter out = resp.getWriter()) {
      out.write(JacksonUtility.toJson(body));
    }
  }

  /** {@code {"detail": message}}, the error body shared by every endpoint. */
  public static void sendError(HttpServletResponse resp, int status, String message)
      throws IOException {
    send(resp, status, Map.of("detail", message));
  }
}
