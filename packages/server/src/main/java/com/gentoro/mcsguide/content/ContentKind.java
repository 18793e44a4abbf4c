package com.gentoro.mcsguide.content;

import com.gentoro.mcsguide.content.model.BestPractice;
import com.gentoro.mcsguide.content.model.GovernanceEntry;
import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import com.gentoro.mcsguide.content.model.Snippet;
import com.gentoro.mcsguide.content.model.Tip;
import com.gentoro.mcsguide.content.model.TroubleshootingGuide;

/**
 * The five record kinds served by the knowledge base, with the names each surface uses for them:
 * the dataset file, the REST path segment and the MCP resource URI scheme.
 */
public enum ContentKind {
  BEST_PRACTICE(
      BestPractice.class, "best_practices.json", "best-practices", "bestpractice", "Best practice"),
  SNIPPET(Snippet.class, "snippets.json", "snippets", "snippet", "Snippet"),
  TROUBLESHOOTING(
      TroubleshootingGuide.class,
      "troubleshooting.json",
      "troubleshooting",
      "troubleshooting",
      "Troubleshooting guide"),
  TIP(Tip.class, "tips.json", "tips", "tip", "Tip"),
  GOVERNANCE(
      GovernanceEntry.class, "governance.json", "governance", "governance", "Governance info");

  private final Class<? extends KnowledgeRecord> recordType;
  private final String fileName;
  private final String pathSegment;
  private final String uriScheme;
  private final String displayName;

  ContentKind(
      Class<? extends KnowledgeRecord> recordType,
      String fileName,
      String pathSegment,
      String uriScheme,
      String displayName) {
    this.recordType = recordType;
    this.fileName = fileName;
    this.pathSegment = pathSegment;
    this.uriScheme = uriScheme;
    this.displayName = displayName;
  }

  public Class<? extends KnowledgeRecord> recordType() {
    return recordType;
  }

  public String fileName() {
    return fileName;
  }

  public String pathSegment() {
    return pathSegment;
  }

  public String uriScheme() {
    return uriScheme;
  }

  public String displayName() {
    return displayName;
  }

  /** {@code scheme://key}, the MCP resource URI of a record of this kind. */
  public String resourceUri(String key) {
    return uriScheme + "://" + key;
  }
}
