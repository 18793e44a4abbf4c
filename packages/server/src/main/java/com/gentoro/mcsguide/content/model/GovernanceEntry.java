package com.gentoro.mcsguide.content.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Governance rules for one platform feature. Entries are keyed by {@link #feature()}, a lower-case
 * hyphenated name such as {@code http-connector}.
 *
 * <p>{@link #zones()} keeps the declaration order of the dataset; its keys are {@link
 * GovernanceZone} wire names and are validated when the store is loaded.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GovernanceEntry(
    String feature,
    String displayName,
    GovernanceZone minimumZone,
    Map<String, ZonePolicy> zones,
    String justificationTemplate)
    implements KnowledgeRecord {

  public GovernanceEntry {
    zones =
        zones == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(zones));
  }

  @Override
  public String key() {
    return feature;
  }

  @Override
  public String title() {
    return displayName == null ? feature : displayName;
  }
}
