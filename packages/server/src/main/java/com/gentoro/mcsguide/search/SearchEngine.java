package com.gentoro.mcsguide.search;

import com.gentoro.mcsguide.content.ContentKind;
import com.gentoro.mcsguide.content.ContentStore;
import com.gentoro.mcsguide.content.model.GovernanceEntry;
import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import com.gentoro.mcsguide.content.model.SnippetLanguage;
import com.gentoro.mcsguide.exception.NotFoundException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Search and lookup over a {@link ContentStore}, shared by the REST and MCP surfaces.
 *
 * <p>All methods are pure functions of the (immutable) store and their arguments, so a single
 * instance is used from every request thread.
 *
 * <ul>
 *   <li>A query matches a record when one of the kind's searchable fields contains it, ignoring
 *       case. A blank query matches every record.
 *   <li>Filters compare enumerable fields exactly, ignoring case. A value outside the field's
 *       closed set matches nothing; it is not an error.
 *   <li>Query and filters are combined with AND; results keep dataset order.
 * </ul>
 */
public class SearchEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(SearchEngine.class);

  private final ContentStore store;

  public SearchEngine(ContentStore store) {
    this.store = store;
  }

  public SearchResult search(ContentKind kind, SearchRequest request) {
    Map<String, Function<KnowledgeRecord, String>> filterFields = SearchableFields.filters(kind);
    String needle = request.hasQuery() ? request.query().toLowerCase(Locale.ROOT) : null;

    List<KnowledgeRecord> matches =
        store.all(kind).stream()
            .filter(record -> matchesFilters(kind, record, request.filters(), filterFields))
            .filter(record -> needle == null || matchesQuery(kind, record, needle))
            .toList();
    log.debug(
        "search kind={} query='{}' filters={} -> {} matches",
        kind,
        request.query(),
        request.filters(),
        matches.size());
    return SearchResult.of(matches);
  }

  /**
   * Exact lookup by key.
   *
   * @throws NotFoundException when the key is unknown
   */
  public KnowledgeRecord lookup(ContentKind kind, String key) {
    return store.require(kind, key);
  }

  /**
   * Governance entry whose feature equals the normalized name, e.g. {@code "HTTP Connector"} and
   * {@code "http_connector"} both resolve {@code http-connector}.
   *
   * @throws NotFoundException when no entry has that feature
   */
  public GovernanceEntry governance(String feature) {
    String normalized = normalizeFeature(feature);
    return store
        .get(ContentKind.GOVERNANCE, normalized)
        .map(GovernanceEntry.class::cast)
        .orElseThrow(
            () ->
                new NotFoundException(
                    "No governance info for: " + feature, Map.of("feature", normalized)));
  }

  /**
   * Exact governance lookup, then the first entry whose feature or display name contains the
   * normalized name. Used where callers describe a feature loosely.
   */
  public Optional<GovernanceEntry> findGovernance(String feature) {
    String normalized = normalizeFeature(feature);
    if (normalized.isEmpty()) return Optional.empty();
    Optional<KnowledgeRecord> exact = store.get(ContentKind.GOVERNANCE, normalized);
    if (exact.isPresent()) {
      return exact.map(GovernanceEntry.class::cast);
    }
    String spaced = normalized.replace('-', ' ');
    return store.all(ContentKind.GOVERNANCE, GovernanceEntry.class).stream()
        .filter(
            e ->
                e.feature().contains(normalized)
                    || (e.displayName() != null
                        && e.displayName().toLowerCase(Locale.ROOT).contains(spaced)))
        .findFirst();
  }

  static String normalizeFeature(String feature) {
    if (feature == null) return "";
    return feature.trim().toLowerCase(Locale.ROOT).replace(' ', '-').replace('_', '-');
  }

  private static boolean matchesFilters(
      ContentKind kind,
      KnowledgeRecord record,
      Map<String, String> filters,
      Map<String, Function<KnowledgeRecord, String>> filterFields) {
    for (Map.Entry<String, String> filter : filters.entrySet()) {
      Function<KnowledgeRecord, String> field = filterFields.get(filter.getKey());
      if (field == null) {
        continue;
      }
      if (kind == ContentKind.SNIPPET
          && "language".equals(filter.getKey())
          && SnippetLanguage.ANY.wireName().equalsIgnoreCase(filter.getValue())) {
        continue;
      }
      String actual = field.apply(record);
      if (actual == null || !actual.equalsIgnoreCase(filter.getValue())) {
        return false;
      }
    }
    return true;
  }

  private static boolean matchesQuery(ContentKind kind, KnowledgeRecord record, String needle) {
    for (String value : SearchableFields.text(kind, record)) {
      if (value.toLowerCase(Locale.ROOT).contains(needle)) {
        return true;
      }
    }
    return false;
  }
}
