package com.gentoro.mcsguide.http.filter;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Objects;

/**
 * Decision of a {@link RequestRule}. {@link #next} hands a (possibly rewritten) request to the
 * following rule; {@link #dispatch} skips the remaining rules and passes the request to its
 * servlet; {@link #handled} means the rule already wrote the response.
 */
public final class RuleOutcome {

  public enum Action {
    NEXT,
    DISPATCH,
    HANDLED
  }

  private static final RuleOutcome HANDLED = new RuleOutcome(Action.HANDLED, null);

  private final Action action;
  private final HttpServletRequest request;

  private RuleOutcome(Action action, HttpServletRequest request) {
    this.action = action;
    this.request = request;
  }

  public static RuleOutcome next(HttpServletRequest request) {
    return new RuleOutcome(Action.NEXT, Objects.requireNonNull(request, "request"));
  }

  public static RuleOutcome dispatch(HttpServletRequest request) {
    return new RuleOutcome(Action.DISPATCH, Objects.requireNonNull(request, "request"));
  }

  public static RuleOutcome handled() {
    return HANDLED;
  }

  public Action action() {
    return action;
  }

  /** The request to carry forward; null once handled. */
  public HttpServletRequest request() {
    return request;
  }
}
