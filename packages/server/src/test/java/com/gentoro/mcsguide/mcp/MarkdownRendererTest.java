package com.gentoro.mcsguide.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcsguide.content.model.BestPractice;
import com.gentoro.mcsguide.content.model.Difficulty;
import com.gentoro.mcsguide.content.model.GovernanceEntry;
import com.gentoro.mcsguide.content.model.GovernanceZone;
import com.gentoro.mcsguide.content.model.ResolutionStep;
import com.gentoro.mcsguide.content.model.Snippet;
import com.gentoro.mcsguide.content.model.SnippetLanguage;
import com.gentoro.mcsguide.content.model.Tip;
import com.gentoro.mcsguide.content.model.TroubleshootingGuide;
import com.gentoro.mcsguide.content.model.ZonePolicy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MarkdownRendererTest {

  @Test
  void bestPracticeShowsCategoryDifficultyAndTags() {
    BestPractice bp =
        new BestPractice(
            "bp-1",
            "Name topics clearly",
            "topics",
            "Use verbs.",
            "Easier to find.",
            "Reset password",
            "Topic 1",
            Difficulty.BEGINNER,
            List.of("topics", "naming"));

    String md = MarkdownRenderer.render(bp);

    assertTrue(md.startsWith("# Name topics clearly\n"));
    assertTrue(md.contains("**Category**: topics"));
    assertTrue(md.contains("**Difficulty**: beginner"));
    assertTrue(md.contains("**Bad example**: Topic 1"));
    assertTrue(md.endsWith("**Tags**: topics, naming"));
  }

  @Test
  void snippetCodeIsFencedWithItsLanguage() {
    Snippet snippet =
        new Snippet(
            "snip-1",
            "Blank check",
            SnippetLanguage.POWER_FX,
            "variables",
            "d",
            "IsBlank(x)",
            "e",
            "u",
            List.of());

    assertTrue(MarkdownRenderer.render(snippet).contains("```power-fx\nIsBlank(x)\n```"));
  }

  @Test
  void troubleshootingListsSymptomsCausesAndNumberedSteps() {
    TroubleshootingGuide guide =
        new TroubleshootingGuide(
            "ts-1",
            "Login fails",
            "auth",
            List.of("401"),
            List.of("Expired token"),
            List.of(new ResolutionStep(1, "Sign in again", "Use the service account.")),
            List.of());

    String md = MarkdownRenderer.render(guide);

    assertTrue(md.contains("**Symptoms**:\n- 401"));
    assertTrue(md.contains("**Possible causes**:\n- Expired token"));
    assertTrue(md.contains("**Step 1**: Sign in again\n  Use the service account."));
  }

  @Test
  void tipOmitsEmptyWhyItMatters() {
    Tip tip = new Tip("tip-1", "Test often", "testing", "Use the test pane.", null, List.of("x"));
    String md = MarkdownRenderer.render(tip);
    assertFalse(md.contains("Why it matters"));
    assertTrue(md.contains("Use the test pane."));
  }

  @Test
  void governanceShowsEveryZoneInOrder() {
    Map<String, ZonePolicy> zones = new LinkedHashMap<>();
    zones.put("green", new ZonePolicy(false, "Blocked.", List.of()));
    zones.put("red", new ZonePolicy(true, null, List.of("Security review", "Owner")));
    GovernanceEntry entry =
        new GovernanceEntry(
            "http-connector", "HTTP request node", GovernanceZone.RED, zones, "We need {x}.");

    String md = MarkdownRenderer.render(entry);

    assertTrue(md.startsWith("# HTTP request node"));
    assertTrue(md.contains("**Minimum zone required**: red"));
    assertTrue(md.indexOf("**GREEN**: Not available") < md.indexOf("**RED**: Available"));
    assertTrue(md.contains("Reason: Blocked."));
    assertTrue(md.contains("Requirements: Security review, Owner"));
    assertTrue(md.endsWith("> We need {x}."));
  }
}
