package com.gentoro.mcsguide.content.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Tip(
    String id, String title, String category, String tip, String whyItMatters, List<String> tags)
    implements KnowledgeRecord {

  public Tip {
    tags = Lists.frozen(tags);
  }

  @Override
  public String key() {
    return id;
  }
}
