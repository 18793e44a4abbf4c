package com.gentoro.mcsguide.mcp;

import com.gentoro.mcsguide.content.model.BestPractice;
import com.gentoro.mcsguide.content.model.GovernanceEntry;
import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import com.gentoro.mcsguide.content.model.ResolutionStep;
import com.gentoro.mcsguide.content.model.Snippet;
import com.gentoro.mcsguide.content.model.Tip;
import com.gentoro.mcsguide.content.model.TroubleshootingGuide;
import com.gentoro.mcsguide.content.model.ZonePolicy;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human readable Markdown rendition of a record, offered next to the JSON content when an MCP
 * client reads a resource.
 */
public final class MarkdownRenderer {

  private MarkdownRenderer() {}

  public static String render(KnowledgeRecord record) {
    if (record instanceof BestPractice bp) return render(bp);
    if (record instanceof Snippet s) return render(s);
    if (record instanceof TroubleshootingGuide g) return render(g);
    if (record instanceof Tip t) return render(t);
    if (record instanceof GovernanceEntry e) return render(e);
    throw new IllegalArgumentException("Unsupported record type: " + record.getClass());
  }

  static String render(BestPractice bp) {
    StringBuilder md = new StringBuilder();
    md.append("# ").append(bp.title()).append("\n\n");
    md.append("**Category**: ").append(orNa(bp.category())).append('\n');
    md.append("**Difficulty**: ")
        .append(bp.difficulty() == null ? "N/A" : bp.difficulty().wireName())
        .append("\n\n");
    md.append("**Description**: ").append(orEmpty(bp.description())).append("\n\n");
    md.append("**Rationale**: ").append(orEmpty(bp.rationale())).append("\n\n");
    md.append("**Good example**: ").append(orEmpty(bp.exampleGood())).append('\n');
    md.append("**Bad example**: ").append(orEmpty(bp.exampleBad())).append("\n\n");
    md.append("**Tags**: ").append(String.join(", ", bp.tags()));
    return md.toString();
  }

  static String render(Snippet s) {
    String language = s.language() == null ? "" : s.language().wireName();
    StringBuilder md = new StringBuilder();
    md.append("# ").append(s.title()).append("\n\n");
    md.append("**Language**: ").append(language.isEmpty() ? "unknown" : language).append('\n');
    md.append("**Use case**: ").append(orEmpty(s.useCase())).append("\n\n");
    md.append("```").append(language).append('\n').append(orEmpty(s.code())).append("\n```\n\n");
    md.append("**Explanation**: ").append(orEmpty(s.explanation())).append("\n\n");
    md.append("**Tags**: ").append(String.join(", ", s.tags()));
    return md.toString();
  }

  static String render(TroubleshootingGuide g) {
    StringBuilder md = new StringBuilder();
    md.append("# ").append(g.title());
    bullets(md, "Symptoms", g.symptoms());
    bullets(md, "Possible causes", g.causes());
    if (!g.resolutionSteps().isEmpty()) {
      md.append("\n\n**Resolution steps**:");
      for (ResolutionStep step : g.resolutionSteps()) {
        md.append("\n\n**Step ").append(step.step()).append("**: ").append(step.action());
        if (step.details() != null && !step.details().isBlank()) {
          md.append("\n  ").append(step.details());
        }
      }
    }
    return md.toString();
  }

  static String render(Tip t) {
    StringBuilder md = new StringBuilder();
    md.append("# ").append(t.title()).append("\n\n");
    md.append(orEmpty(t.tip()));
    if (t.whyItMatters() != null && !t.whyItMatters().isBlank()) {
      md.append("\n\n*Why it matters*: ").append(t.whyItMatters());
    }
    md.append("\n\n**Tags**: ").append(String.join(", ", t.tags()));
    return md.toString();
  }

  static String render(GovernanceEntry e) {
    StringBuilder md = new StringBuilder();
    md.append("# ").append(e.title()).append("\n\n");
    md.append("**Minimum zone required**: ")
        .append(e.minimumZone() == null ? "unknown" : e.minimumZone().wireName())
        .append("\n\n**Availability by zone**:");
    for (Map.Entry<String, ZonePolicy> zone : e.zones().entrySet()) {
      ZonePolicy policy = zone.getValue();
      md.append("\n\n**")
          .append(zone.getKey().toUpperCase(Locale.ROOT))
          .append("**: ")
          .append(policy != null && policy.available() ? "Available" : "Not available");
      if (policy == null) continue;
      if (policy.reason() != null && !policy.reason().isBlank()) {
        md.append("\n  Reason: ").append(policy.reason());
      }
      if (!policy.requirements().isEmpty()) {
        md.append("\n  Requirements: ").append(String.join(", ", policy.requirements()));
      }
    }
    if (e.justificationTemplate() != null && !e.justificationTemplate().isBlank()) {
      md.append("\n\n**Justification template**:\n> ").append(e.justificationTemplate());
    }
    return md.toString();
  }

  private static void bullets(StringBuilder md, String heading, List<String> items) {
    if (items.isEmpty()) return;
    md.append("\n\n**").append(heading).append("**:");
    for (String item : items) {
      md.append("\n- ").append(item);
    }
  }

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }

  private static String orNa(String value) {
    return value == null || value.isBlank() ? "N/A" : value;
  }
}
