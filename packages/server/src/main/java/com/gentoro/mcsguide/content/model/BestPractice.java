package com.gentoro.mcsguide.content.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BestPractice(
    String id,
    String title,
    String category,
    String description,
    String rationale,
    String exampleGood,
    String exampleBad,
    Difficulty difficulty,
    List<String> tags)
    implements KnowledgeRecord {

  public BestPractice {
    tags = Lists.frozen(tags);
  }

  @Override
  public String key() {
    return id;
  }
}
