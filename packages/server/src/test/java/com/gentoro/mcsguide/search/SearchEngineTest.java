package com.gentoro.mcsguide.search;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcsguide.content.ContentKind;
import com.gentoro.mcsguide.content.ContentLoader;
import com.gentoro.mcsguide.content.ContentStore;
import com.gentoro.mcsguide.content.model.BestPractice;
import com.gentoro.mcsguide.content.model.GovernanceEntry;
import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import com.gentoro.mcsguide.exception.NotFoundException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SearchEngine over the fixture dataset")
class SearchEngineTest {

  private SearchEngine engine;

  @BeforeEach
  void setUp() {
    ContentStore store = new ContentLoader("classpath:fixtures/data").load();
    engine = new SearchEngine(store);
  }

  private static List<String> keys(SearchResult result) {
    return result.results().stream().map(KnowledgeRecord::key).toList();
  }

  @Test
  void queryAndCategoryFilterAreCombined() {
    SearchResult result =
        engine.search(
            ContentKind.BEST_PRACTICE,
            new SearchRequest("connector", Map.of("category", "connectors")));

    assertEquals(List.of("bp-001"), keys(result));
    assertEquals(1, result.total());
  }

  @Test
  void queryAloneMatchesAnySearchableField() {
    // bp-001 by title, bp-002 by description
    SearchResult result = engine.search(ContentKind.BEST_PRACTICE, SearchRequest.of("CONNECTOR"));
    assertEquals(List.of("bp-001", "bp-002"), keys(result));
  }

  @Test
  void everyResultContainsTheQuery() {
    String query = "topic";
    for (ContentKind kind : ContentKind.values()) {
      SearchResult result = engine.search(kind, SearchRequest.of(query));
      assertEquals(result.results().size(), result.total());
      for (KnowledgeRecord record : result.results()) {
        boolean hit =
            SearchableFields.text(kind, record).stream()
                .anyMatch(v -> v.toLowerCase(Locale.ROOT).contains(query));
        assertTrue(hit, () -> record.key() + " does not contain " + query);
      }
    }
  }

  @Test
  void blankQueryReturnsEverythingInDatasetOrder() {
    SearchResult result = engine.search(ContentKind.SNIPPET, new SearchRequest("  ", Map.of()));
    assertEquals(List.of("snip-001", "snip-002", "snip-003"), keys(result));
    assertEquals(3, result.total());
  }

  @Test
  void filtersIgnoreCase() {
    SearchResult result =
        engine.search(
            ContentKind.BEST_PRACTICE, SearchRequest.all().withFilter("difficulty", "ADVANCED"));
    assertEquals(List.of("bp-002"), keys(result));
  }

  @Test
  void anyLanguageImposesNoConstraint() {
    SearchResult any =
        engine.search(ContentKind.SNIPPET, SearchRequest.all().withFilter("language", "any"));
    assertEquals(3, any.total());

    SearchResult yaml =
        engine.search(ContentKind.SNIPPET, SearchRequest.all().withFilter("language", "yaml"));
    assertEquals(List.of("snip-002"), keys(yaml));
  }

  @Test
  void unknownFilterValueMatchesNothing() {
    SearchResult result =
        engine.search(
            ContentKind.BEST_PRACTICE, SearchRequest.all().withFilter("difficulty", "expert"));
    assertTrue(result.isEmpty());
    assertEquals(0, result.total());
  }

  @Test
  void unknownFilterNameIsIgnored() {
    SearchResult result =
        engine.search(ContentKind.TIP, SearchRequest.all().withFilter("colour", "blue"));
    assertEquals(2, result.total());
  }

  @Test
  void queryWithoutMatchesIsEmptyNotAnError() {
    SearchResult result =
        engine.search(
            ContentKind.TROUBLESHOOTING,
            new SearchRequest("no such words anywhere", Map.of("category", "connectors")));
    assertTrue(result.isEmpty());
  }

  @Test
  void troubleshootingSearchScansSymptomsAndCauses() {
    assertEquals(
        List.of("ts-001"),
        keys(engine.search(ContentKind.TROUBLESHOOTING, SearchRequest.of("expired"))));
    assertEquals(
        List.of("ts-002"),
        keys(engine.search(ContentKind.TROUBLESHOOTING, SearchRequest.of("unrelated topic"))));
  }

  @Test
  void lookupReturnsRecordWithSameId() {
    KnowledgeRecord record = engine.lookup(ContentKind.BEST_PRACTICE, "bp-003");
    assertEquals("bp-003", record.key());
    assertInstanceOf(BestPractice.class, record);
  }

  @Test
  void lookupOfUnknownIdThrowsNotFound() {
    NotFoundException ex =
        assertThrows(NotFoundException.class, () -> engine.lookup(ContentKind.TIP, "tip-999"));
    assertTrue(ex.getMessage().contains("tip-999"));
  }

  @Test
  void governanceNormalizesFeatureNames() {
    assertEquals("http-connector", engine.governance("HTTP Connector").feature());
    assertEquals("http-connector", engine.governance("http_connector").feature());
    assertEquals("mcp-servers", engine.governance(" mcp-servers ").feature());
  }

  @Test
  void governanceIsExactAndReportsTheRequestedName() {
    NotFoundException ex =
        assertThrows(NotFoundException.class, () -> engine.governance("connector"));
    assertEquals("No governance info for: connector", ex.getMessage());
  }

  @Test
  void findGovernanceFallsBackToSubstring() {
    GovernanceEntry byFeature = engine.findGovernance("mcp").orElseThrow();
    assertEquals("mcp-servers", byFeature.feature());

    GovernanceEntry byDisplayName = engine.findGovernance("Request Node").orElseThrow();
    assertEquals("http-connector", byDisplayName.feature());

    assertTrue(engine.findGovernance("sharepoint").isEmpty());
    assertTrue(engine.findGovernance("  ").isEmpty());
  }

  @Test
  void normalizeFeatureLowercasesAndHyphenates() {
    assertEquals("red-extra-zone", SearchEngine.normalizeFeature(" Red_Extra Zone "));
    assertEquals("", SearchEngine.normalizeFeature(null));
  }
}
