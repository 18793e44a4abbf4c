package com.gentoro.mcsguide.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Policy tier gating feature availability, from least to most restricted. */
public enum GovernanceZone {
  GREEN("green"),
  YELLOW("yellow"),
  RED("red"),
  RED_EXTRA("red-extra");

  private final String wireName;

  GovernanceZone(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static GovernanceZone fromWireName(String value) {
    for (GovernanceZone candidate : values()) {
      if (candidate.wireName.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown GovernanceZone value: " + value);
  }
}
