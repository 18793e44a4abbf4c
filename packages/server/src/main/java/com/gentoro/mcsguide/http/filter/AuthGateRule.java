package com.gentoro.mcsguide.http.filter;

import com.gentoro.mcsguide.exception.UnauthorizedException;
import com.gentoro.mcsguide.http.JsonResponses;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** Last rule of the chain: everything that reaches it must present a valid API key. */
public class AuthGateRule implements RequestRule {
  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(AuthGateRule.class);

  private final ApiKeyAuthenticator authenticator;

  public AuthGateRule(ApiKeyAuthenticator authenticator) {
    this.authenticator = authenticator;
  }

  @Override
  public boolean matches(HttpServletRequest request) {
    return true;
  }

  @Override
  public RuleOutcome apply(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    try {
      authenticator.authenticate(request.getHeader(authenticator.headerName()));
      return RuleOutcome.dispatch(request);
    } catch (UnauthorizedException e) {
      log.debug(
          "Rejected {} {} from {}: {}",
          request.getMethod(),
          RequestPaths.path(request),
          request.getRemoteAddr(),
          e.getMessage());
      JsonResponses.sendError(response, HttpServletResponse.SC_UNAUTHORIZED, e.getMessage());
      return RuleOutcome.handled();
    }
  }
}
