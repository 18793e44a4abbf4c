package com.gentoro.mcsguide.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Language a code snippet is written in; {@code any} marks language-agnostic snippets. */
public enum SnippetLanguage {
  POWER_FX("power-fx"),
  YAML("yaml"),
  JSON("json"),
  ANY("any");

  private final String wireName;

  SnippetLanguage(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static SnippetLanguage fromWireName(String value) {
    for (SnippetLanguage candidate : values()) {
      if (candidate.wireName.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown SnippetLanguage value: " + value);
  }
}
