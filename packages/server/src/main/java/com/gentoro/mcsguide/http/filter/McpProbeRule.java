package com.gentoro.mcsguide.http.filter;

import com.gentoro.mcsguide.http.JsonResponses;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers connector tooling probing the MCP endpoint with a plain {@code GET}. The probe carries
 * no session and would be rejected by the transport, so it never reaches it.
 */
public class McpProbeRule implements RequestRule {
  static final String PROTOCOL = "mcp-streamable-1.0";

  private final String mcpEndpoint;
  private final Map<String, String> payload;

  public McpProbeRule(String mcpEndpoint, String serverName) {
    this.mcpEndpoint = mcpEndpoint;
    Map<String, String> body = new LinkedHashMap<>();
    body.put("status", "ok");
    body.put("server", serverName);
    body.put("protocol", PROTOCOL);
    this.payload = Collections.unmodifiableMap(body);
  }

  @Override
  public boolean matches(HttpServletRequest request) {
    return "GET".equalsIgnoreCase(request.getMethod())
        && RequestPaths.isUnder(request, mcpEndpoint);
  }

  @Override
  public RuleOutcome apply(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    JsonResponses.send(response, HttpServletResponse.SC_OK, payload);
    return RuleOutcome.handled();
  }
}
