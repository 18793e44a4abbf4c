package com.gentoro.mcsguide.http.filter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Restores the {@code Accept} header of MCP POSTs. The gateway in front of the service strips it,
 * and the streamable transport rejects requests that do not accept both JSON and event streams.
 */
public class AcceptHeaderRepairRule implements RequestRule {
  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(AcceptHeaderRepairRule.class);

  static final String EVENT_STREAM = "text/event-stream";
  static final String REPAIRED_ACCEPT = "application/json, " + EVENT_STREAM;

  private final String mcpEndpoint;

  public AcceptHeaderRepairRule(String mcpEndpoint) {
    this.mcpEndpoint = mcpEndpoint;
  }

  @Override
  public boolean matches(HttpServletRequest request) {
    if (!"POST".equalsIgnoreCase(request.getMethod())
        || !RequestPaths.isUnder(request, mcpEndpoint)) {
      return false;
    }
    String accept = request.getHeader("Accept");
    return accept == null || !accept.contains(EVENT_STREAM);
  }

  @Override
  public RuleOutcome apply(HttpServletRequest request, HttpServletResponse response) {
    log.debug("Repairing Accept header '{}' on MCP request", request.getHeader("Accept"));
    return RuleOutcome.next(new AcceptRepairedRequest(request, REPAIRED_ACCEPT));
  }
}
