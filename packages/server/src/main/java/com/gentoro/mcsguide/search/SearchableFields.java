package com.gentoro.mcsguide.search;

import com.gentoro.mcsguide.content.ContentKind;
import com.gentoro.mcsguide.content.model.BestPractice;
import com.gentoro.mcsguide.content.model.GovernanceEntry;
import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import com.gentoro.mcsguide.content.model.Snippet;
import com.gentoro.mcsguide.content.model.Tip;
import com.gentoro.mcsguide.content.model.TroubleshootingGuide;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Per-kind tables of the text fields a query scans and the enumerable fields filters compare. */
final class SearchableFields {

  private SearchableFields() {}

  /** Values a query is matched against; list-valued fields contribute one entry per element. */
  static List<String> text(ContentKind kind, KnowledgeRecord record) {
    List<String> values = new ArrayList<>();
    switch (kind) {
      case BEST_PRACTICE -> {
        BestPractice bp = (BestPractice) record;
        add(values, bp.title(), bp.description(), bp.rationale());
        values.addAll(bp.tags());
      }
      case SNIPPET -> {
        Snippet s = (Snippet) record;
        add(values, s.title(), s.description(), s.useCase(), s.code());
        values.addAll(s.tags());
      }
      case TROUBLESHOOTING -> {
        TroubleshootingGuide g = (TroubleshootingGuide) record;
        add(values, g.title());
        addAll(values, g.symptoms(), g.causes(), g.tags());
      }
      case TIP -> {
        Tip t = (Tip) record;
        add(values, t.title(), t.category(), t.tip());
        values.addAll(t.tags());
      }
      case GOVERNANCE -> {
        GovernanceEntry e = (GovernanceEntry) record;
        add(values, e.feature(), e.displayName());
      }
    }
    return values;
  }

  private static final Map<String, Function<KnowledgeRecord, String>> BEST_PRACTICE_FILTERS =
      Map.of(
          "category", r -> ((BestPractice) r).category(),
          "difficulty", r -> ((BestPractice) r).difficulty().wireName());

  private static final Map<String, Function<KnowledgeRecord, String>> SNIPPET_FILTERS =
      Map.of(
          "category", r -> ((Snippet) r).category(),
          "language", r -> ((Snippet) r).language().wireName());

  private static final Map<String, Function<KnowledgeRecord, String>> TROUBLESHOOTING_FILTERS =
      Map.of("category", r -> ((TroubleshootingGuide) r).category());

  private static final Map<String, Function<KnowledgeRecord, String>> TIP_FILTERS =
      Map.of("category", r -> ((Tip) r).category());

  /** Filterable fields of a kind; filters naming any other field are ignored. */
  static Map<String, Function<KnowledgeRecord, String>> filters(ContentKind kind) {
    return switch (kind) {
      case BEST_PRACTICE -> BEST_PRACTICE_FILTERS;
      case SNIPPET -> SNIPPET_FILTERS;
      case TROUBLESHOOTING -> TROUBLESHOOTING_FILTERS;
      case TIP -> TIP_FILTERS;
      case GOVERNANCE -> Map.of();
    };
  }

  private static void add(List<String> values, String... fields) {
    for (String field : fields) {
      if (field != null) values.add(field);
    }
  }

  @SafeVarargs
  private static void addAll(List<String> values, Collection<String>... lists) {
    for (Collection<String> list : lists) {
      values.addAll(list);
    }
  }
}
