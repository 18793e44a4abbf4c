package com.gentoro.mcsguide.http.filter;

import jakarta.servlet.http.HttpServletRequest;

final class RequestPaths {
  private RequestPaths() {}

  /** Request path without the context path, never empty. */
  static String path(HttpServletRequest request) {
    String uri = request.getRequestURI();
    if (uri == null || uri.isEmpty()) return "/";
    String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      uri = uri.substring(contextPath.length());
    }
    return uri.isEmpty() ? "/" : uri;
  }

  /** True for the endpoint itself, with or without trailing slash, and anything below it. */
  static boolean isUnder(HttpServletRequest request, String endpoint) {
    String path = path(request);
    return path.equals(endpoint) || path.startsWith(endpoint + "/");
  }
}
