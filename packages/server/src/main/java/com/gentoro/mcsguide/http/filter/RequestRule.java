package com.gentoro.mcsguide.http.filter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** One predicate/action pair of the request normalization chain. */
public interface RequestRule {

  boolean matches(HttpServletRequest request);

  /** Only called when {@link #matches} returned true. */
  RuleOutcome apply(HttpServletRequest request, HttpServletResponse response) throws IOException;
}
