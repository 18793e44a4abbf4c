package com.gentoro.mcsguide.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Skill level a best practice is aimed at. */
public enum Difficulty {
  BEGINNER("beginner"),
  INTERMEDIATE("intermediate"),
  ADVANCED("advanced");

  private final String wireName;

  Difficulty(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static Difficulty fromWireName(String value) {
    for (Difficulty candidate : values()) {
      if (candidate.wireName.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown Difficulty value: " + value);
  }
}
