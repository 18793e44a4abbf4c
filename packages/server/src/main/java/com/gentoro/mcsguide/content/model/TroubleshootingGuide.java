package com.gentoro.mcsguide.content.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Symptoms, likely causes and an ordered resolution path for a known problem. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TroubleshootingGuide(
    String id,
    String title,
    String category,
    List<String> symptoms,
    List<String> causes,
    List<ResolutionStep> resolutionSteps,
    List<String> tags)
    implements KnowledgeRecord {

  public TroubleshootingGuide {
    symptoms = Lists.frozen(symptoms);
    causes = Lists.frozen(causes);
    resolutionSteps = Lists.frozen(resolutionSteps);
    tags = Lists.frozen(tags);
  }

  @Override
  public String key() {
    return id;
  }
}
