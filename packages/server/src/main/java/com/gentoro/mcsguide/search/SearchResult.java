package com.gentoro.mcsguide.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import java.util.List;

/**
 * Every record matching a search, in dataset order. {@code total} is always the size of {@code
 * results}; nothing is paginated away.
 */
public record SearchResult(List<KnowledgeRecord> results, int total) {

  public SearchResult {
    results = List.copyOf(results);
    if (total != results.size()) {
      throw new IllegalArgumentException(
          "total " + total + " does not match " + results.size() + " results");
    }
  }

  public static SearchResult of(List<? extends KnowledgeRecord> results) {
    return new SearchResult(List.copyOf(results), results.size());
  }

  @JsonIgnore
  public boolean isEmpty() {
    return results.isEmpty();
  }
}
