package com.gentoro.mcsguide.content;

import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import com.gentoro.mcsguide.exception.NotFoundException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory collections of knowledge records, one per {@link ContentKind}.
 *
 * <p>A store is built once by {@link ContentLoader} and never changes afterwards, so it is shared
 * between request threads without synchronization. Lists preserve the order of the dataset files.
 */
public final class ContentStore {

  private final Map<ContentKind, List<KnowledgeRecord>> records;
  private final Map<ContentKind, Map<String, KnowledgeRecord>> index;

  ContentStore(Map<ContentKind, List<? extends KnowledgeRecord>> collections) {
    Map<ContentKind, List<KnowledgeRecord>> recs = new EnumMap<>(ContentKind.class);
    Map<ContentKind, Map<String, KnowledgeRecord>> idx = new EnumMap<>(ContentKind.class);
    for (ContentKind kind : ContentKind.values()) {
      List<KnowledgeRecord> items = List.copyOf(collections.getOrDefault(kind, List.of()));
      Map<String, KnowledgeRecord> byKey = new LinkedHashMap<>();
      for (KnowledgeRecord item : items) {
        if (byKey.putIfAbsent(item.key(), item) != null) {
          throw new IllegalArgumentException(
              "Duplicate %s key '%s'".formatted(kind.displayName(), item.key()));
        }
      }
      recs.put(kind, items);
      idx.put(kind, Collections.unmodifiableMap(byKey));
    }
    this.records = Collections.unmodifiableMap(recs);
    this.index = Collections.unmodifiableMap(idx);
  }

  /** All records of a kind, in dataset order. */
  public List<KnowledgeRecord> all(ContentKind kind) {
    return records.get(kind);
  }

  /** All records of a kind, typed. */
  public <T extends KnowledgeRecord> List<T> all(ContentKind kind, Class<T> type) {
    return records.get(kind).stream().map(type::cast).toList();
  }

  public Optional<KnowledgeRecord> get(ContentKind kind, String key) {
    if (key == null) return Optional.empty();
    return Optional.ofNullable(index.get(kind).get(key));
  }

  /**
   * @throws NotFoundException when no record of {@code kind} has the given key
   */
  public KnowledgeRecord require(ContentKind kind, String key) {
    return get(kind, key)
        .orElseThrow(
            () ->
                new NotFoundException(
                    "%s '%s' not found.".formatted(kind.displayName(), key),
                    Map.of("kind", kind.name(), "key", String.valueOf(key))));
  }

  public int count(ContentKind kind) {
    return records.get(kind).size();
  }

  public Map<ContentKind, Integer> counts() {
    Map<ContentKind, Integer> counts = new EnumMap<>(ContentKind.class);
    records.forEach((kind, items) -> counts.put(kind, items.size()));
    return counts;
  }

  public boolean isEmpty() {
    return records.values().stream().allMatch(List::isEmpty);
  }
}
