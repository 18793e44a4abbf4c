package com.gentoro.mcsguide.http.filter;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/**
 * Servlet filter in front of every endpoint. It evaluates an ordered list of {@link RequestRule}s:
 *
 * <ol>
 *   <li>{@link AcceptHeaderRepairRule} rewrites the {@code Accept} header of MCP POSTs
 *   <li>{@link McpProbeRule} answers probe GETs on the MCP endpoint
 *   <li>{@link PreflightBypassRule} answers CORS preflights and lets health checks through
 *   <li>{@link AuthGateRule} requires the API key on everything else
 * </ol>
 *
 * A rule that matches decides whether evaluation continues with the next rule, stops and dispatches
 * to the servlet, or stops because the response was written. A request no terminal rule claims is
 * dispatched. Every response carries a wildcard {@code Access-Control-Allow-Origin}.
 */
public class RequestNormalizationFilter implements Filter {

  private final List<RequestRule> rules;

  public RequestNormalizationFilter(List<RequestRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static RequestNormalizationFilter standard(
      String mcpEndpoint, String serverName, String healthPath, ApiKeyAuthenticator authenticator) {
    return new RequestNormalizationFilter(
        List.of(
            new AcceptHeaderRepairRule(mcpEndpoint),
            new McpProbeRule(mcpEndpoint, serverName),
            new PreflightBypassRule(healthPath),
            new AuthGateRule(authenticator)));
  }

  public List<RequestRule> rules() {
    return rules;
  }

  @Override
  public void doFilter(ServletRequest req, ServletResponse resp, FilterChain chain)
      throws IOException, ServletException {
    if (!(req instanceof HttpServletRequest request)
        || !(resp instanceof HttpServletResponse response)) {
      chain.doFilter(req, resp);
      return;
    }

    response.setHeader(CorsHeaders.ALLOW_ORIGIN, "*");
    response.setHeader(CorsHeaders.EXPOSE_HEADERS, "Mcp-Session-Id");

    HttpServletRequest current = request;
    for (RequestRule rule : rules) {
      if (!rule.matches(current)) {
        continue;
      }
      RuleOutcome outcome = rule.apply(current, response);
      switch (outcome.action()) {
        case HANDLED:
          return;
        case DISPATCH:
          chain.doFilter(outcome.request(), response);
          return;
        case NEXT:
        default:
          current = outcome.request();
      }
    }
    chain.doFilter(current, response);
  }
}
