package com.gentoro.mcsguide.http.filter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Lets requests that never carry credentials through without authentication: CORS preflights
 * ({@code OPTIONS} on any path) are answered here, health checks go straight to their servlet.
 */
public class PreflightBypassRule implements RequestRule {
  static final String ALLOWED_METHODS = "GET, POST, PUT, PATCH, DELETE, OPTIONS, HEAD";
  static final String MAX_AGE_SECONDS = "600";

  private final String healthPath;

  public PreflightBypassRule(String healthPath) {
    this.healthPath = healthPath;
  }

  @Override
  public boolean matches(HttpServletRequest request) {
    return "OPTIONS".equalsIgnoreCase(request.getMethod())
        || healthPath.equals(RequestPaths.path(request));
  }

  @Override
  public RuleOutcome apply(HttpServletRequest request, HttpServletResponse response) {
    if (!"OPTIONS".equalsIgnoreCase(request.getMethod())) {
      return RuleOutcome.dispatch(request);
    }
    response.setHeader(CorsHeaders.ALLOW_ORIGIN, "*");
    response.setHeader(CorsHeaders.ALLOW_METHODS, ALLOWED_METHODS);
    String requested = request.getHeader(CorsHeaders.REQUEST_HEADERS);
    response.setHeader(
        CorsHeaders.ALLOW_HEADERS, requested == null || requested.isBlank() ? "*" : requested);
    response.setHeader(CorsHeaders.MAX_AGE, MAX_AGE_SECONDS);
    response.setStatus(HttpServletResponse.SC_NO_CONTENT);
    return RuleOutcome.handled();
  }
}
