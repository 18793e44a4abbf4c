package com.gentoro.mcsguide.http.filter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/** Request view whose {@code Accept} header is replaced by a fixed value. */
final class AcceptRepairedRequest extends HttpServletRequestWrapper {
  private static final String ACCEPT = "Accept";

  private final String accept;

  AcceptRepairedRequest(HttpServletRequest request, String accept) {
    super(request);
    this.accept = accept;
  }

  @Override
  public String getHeader(String name) {
    return ACCEPT.equalsIgnoreCase(name) ? accept : super.getHeader(name);
  }

  @Override
  public Enumeration<String> getHeaders(String name) {
    if (ACCEPT.equalsIgnoreCase(name)) {
      return Collections.enumeration(List.of(accept));
    }
    return super.getHeaders(name);
  }

  @Override
  public Enumeration<String> getHeaderNames() {
    List<String> names = new ArrayList<>();
    Enumeration<String> original = super.getHeaderNames();
    while (original != null && original.hasMoreElements()) {
      String name = original.nextElement();
      if (!ACCEPT.equalsIgnoreCase(name)) {
        names.add(name);
      }
    }
    names.add(ACCEPT);
    return Collections.enumeration(names);
  }
}
