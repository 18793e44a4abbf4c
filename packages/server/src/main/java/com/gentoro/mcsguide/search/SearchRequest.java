package com.gentoro.mcsguide.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-text query plus structured filters. A blank query or filter value means "no constraint".
 *
 * @param query case-insensitive substring looked up in the kind's searchable fields
 * @param filters filter name (e.g. {@code category}) to expected value
 */
public record SearchRequest(String query, Map<String, String> filters) {

  public SearchRequest {
    Map<String, String> copy = new LinkedHashMap<>();
    if (filters != null) {
      filters.forEach(
          (name, value) -> {
            if (name != null && value != null && !value.isBlank()) {
              copy.put(name, value.trim());
            }
          });
    }
    filters = Collections.unmodifiableMap(copy);
    query = query == null || query.isBlank() ? null : query.trim();
  }

  public static SearchRequest all() {
    return new SearchRequest(null, Map.of());
  }

  public static SearchRequest of(String query) {
    return new SearchRequest(query, Map.of());
  }

  public SearchRequest withFilter(String name, String value) {
    Map<String, String> next = new LinkedHashMap<>(filters);
    next.put(name, value);
    return new SearchRequest(query, next);
  }

  public boolean hasQuery() {
    return query != null;
  }
}
