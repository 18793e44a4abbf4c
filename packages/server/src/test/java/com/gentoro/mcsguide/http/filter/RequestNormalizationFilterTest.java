package com.gentoro.mcsguide.http.filter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Request normalization rules")
class RequestNormalizationFilterTest {

  @Mock private HttpServletRequest request;
  @Mock private HttpServletResponse response;
  @Mock private FilterChain chain;

  private StringWriter body;
  private RequestNormalizationFilter filter;

  @BeforeEach
  void setUp() throws Exception {
    body = new StringWriter();
    when(response.getWriter()).thenReturn(new PrintWriter(body));
    when(request.getContextPath()).thenReturn("");
    filter =
        RequestNormalizationFilter.standard(
            "/mcp",
            "mcs-guide",
            "/health",
            ApiKeyAuthenticator.fromKeyList("X-API-Key", "good-key"));
  }

  private void given(String method, String path) {
    when(request.getMethod()).thenReturn(method);
    when(request.getRequestURI()).thenReturn(path);
  }

  @Test
  void mcpPostWithoutAcceptIsRepairedThenAuthenticated() throws Exception {
    given("POST", "/mcp");
    when(request.getHeader("X-API-Key")).thenReturn("good-key");
    when(request.getHeader("Accept")).thenReturn(null);

    filter.doFilter(request, response, chain);

    ArgumentCaptor<ServletRequest> forwarded = ArgumentCaptor.forClass(ServletRequest.class);
    verify(chain).doFilter(forwarded.capture(), same(response));
    HttpServletRequest repaired = (HttpServletRequest) forwarded.getValue();
    assertEquals("application/json, text/event-stream", repaired.getHeader("Accept"));
    assertEquals("application/json, text/event-stream", repaired.getHeader("accept"));
    assertEquals(
        "application/json, text/event-stream",
        Collections.list(repaired.getHeaders("Accept")).get(0));
  }

  @Test
  void mcpPostWithEventStreamAcceptIsLeftAlone() throws Exception {
    given("POST", "/mcp");
    when(request.getHeader("X-API-Key")).thenReturn("good-key");
    when(request.getHeader("Accept")).thenReturn("application/json, text/event-stream");

    filter.doFilter(request, response, chain);

    verify(chain).doFilter(same(request), same(response));
  }

  @Test
  void getOnMcpEndpointAnswersProbeWithoutCredentials() throws Exception {
    given("GET", "/mcp");

    filter.doFilter(request, response, chain);

    verify(response).setStatus(HttpServletResponse.SC_OK);
    assertEquals(
        "{\"status\":\"ok\",\"server\":\"mcs-guide\",\"protocol\":\"mcp-streamable-1.0\"}",
        body.toString());
    verifyNoInteractions(chain);
  }

  @Test
  void optionsOnAnyPathIsAnsweredWithoutCredentials() throws Exception {
    given("OPTIONS", "/api/v1/snippets");
    when(request.getHeader("Access-Control-Request-Headers")).thenReturn("x-api-key");

    filter.doFilter(request, response, chain);

    verify(response).setStatus(HttpServletResponse.SC_NO_CONTENT);
    verify(response, atLeastOnce()).setHeader("Access-Control-Allow-Origin", "*");
    verify(response).setHeader("Access-Control-Allow-Headers", "x-api-key");
    verify(response).setHeader(eq("Access-Control-Allow-Methods"), any());
    verifyNoInteractions(chain);
  }

  @Test
  void healthIsDispatchedWithoutCredentials() throws Exception {
    given("GET", "/health");

    filter.doFilter(request, response, chain);

    verify(chain).doFilter(same(request), same(response));
    verify(response, never()).setStatus(HttpServletResponse.SC_UNAUTHORIZED);
  }

  @Test
  void missingKeyIsRejectedWith401() throws Exception {
    given("GET", "/api/v1/tips");

    filter.doFilter(request, response, chain);

    verify(response).setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    assertEquals("{\"detail\":\"Invalid or missing API key\"}", body.toString());
    verifyNoInteractions(chain);
  }

  @Test
  void wrongKeyIsRejectedEvenOnTheMcpEndpoint() throws Exception {
    given("POST", "/mcp");
    when(request.getHeader("Accept")).thenReturn("application/json, text/event-stream");
    when(request.getHeader("X-API-Key")).thenReturn("bad-key");

    filter.doFilter(request, response, chain);

    verify(response).setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    verifyNoInteractions(chain);
  }

  @Test
  void validKeyIsDispatched() throws Exception {
    given("GET", "/api/v1/tips");
    when(request.getHeader("X-API-Key")).thenReturn("good-key");

    filter.doFilter(request, response, chain);

    verify(chain).doFilter(same(request), same(response));
  }

  @Test
  void everyResponseAllowsAnyOrigin() throws Exception {
    given("GET", "/api/v1/tips");

    filter.doFilter(request, response, chain);

    verify(response).setHeader("Access-Control-Allow-Origin", "*");
    verify(response).setHeader("Access-Control-Expose-Headers", "Mcp-Session-Id");
  }

  @Test
  void pathsBelowTheMcpEndpointCountAsMcp() {
    given("GET", "/mcp/");
    assertTrue(RequestPaths.isUnder(request, "/mcp"));
    given("GET", "/mcpx");
    assertFalse(RequestPaths.isUnder(request, "/mcp"));
  }
}
