package com.gentoro.mcsguide.content.model;

import java.util.List;

final class Lists {
  private Lists() {}

  /** Immutable copy; a missing list becomes empty. */
  static <T> List<T> frozen(List<T> values) {
    return values == null ? List.of() : List.copyOf(values);
  }
}
