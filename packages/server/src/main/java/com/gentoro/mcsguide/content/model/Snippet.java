package com.gentoro.mcsguide.content.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Copy-paste ready code sample. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Snippet(
    String id,
    String title,
    SnippetLanguage language,
    String category,
    String description,
    String code,
    String explanation,
    String useCase,
    List<String> tags)
    implements KnowledgeRecord {

  public Snippet {
    tags = Lists.frozen(tags);
  }

  @Override
  public String key() {
    return id;
  }
}
