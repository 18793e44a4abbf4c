package com.gentoro.mcsguide.content;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mcsguide.content.model.BestPractice;
import com.gentoro.mcsguide.content.model.GovernanceEntry;
import com.gentoro.mcsguide.content.model.GovernanceZone;
import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import com.gentoro.mcsguide.content.model.Snippet;
import com.gentoro.mcsguide.content.model.Tip;
import com.gentoro.mcsguide.content.model.TroubleshootingGuide;
import com.gentoro.mcsguide.exception.DataLoadException;
import com.gentoro.mcsguide.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the five dataset files into a {@link ContentStore}.
 *
 * <p>The location is either {@code classpath:<dir>} or a filesystem directory ({@code file:} URI or
 * plain path). Every file must be present and valid: a missing file, malformed JSON, a record
 * without its key, a duplicate key, a blank title or category, or an enumerated value outside its
 * closed set all fail the whole load with a {@link DataLoadException}.
 */
public final class ContentLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(ContentLoader.class);

  private final String location;
  private final ClassLoader classLoader;

  public ContentLoader(String location) {
    this(location, Thread.currentThread().getContextClassLoader());
  }

  public ContentLoader(String location, ClassLoader classLoader) {
    if (location == null || location.isBlank()) {
      throw new DataLoadException("Missing data.location configuration");
    }
    this.location = location.trim();
    this.classLoader =
        Objects.requireNonNullElseGet(classLoader, () -> ContentLoader.class.getClassLoader());
  }

  public ContentStore load() {
    Map<ContentKind, List<? extends KnowledgeRecord>> collections =
        new EnumMap<>(ContentKind.class);
    for (ContentKind kind : ContentKind.values()) {
      List<? extends KnowledgeRecord> records = read(kind);
      for (KnowledgeRecord record : records) {
        validate(kind, record);
      }
      collections.put(kind, records);
    }

    ContentStore store;
    try {
      store = new ContentStore(collections);
    } catch (IllegalArgumentException e) {
      throw new DataLoadException(e.getMessage(), Map.of("location", location), e);
    }
    log.info(
        "Loaded: {} best practices, {} snippets, {} troubleshooting, {} tips, {} governance",
        store.count(ContentKind.BEST_PRACTICE),
        store.count(ContentKind.SNIPPET),
        store.count(ContentKind.TROUBLESHOOTING),
        store.count(ContentKind.TIP),
        store.count(ContentKind.GOVERNANCE));
    return store;
  }

  private List<? extends KnowledgeRecord> read(ContentKind kind) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    JavaType listType =
        mapper.getTypeFactory().constructCollectionType(List.class, kind.recordType());
    try (InputStream in = open(kind.fileName())) {
      List<? extends KnowledgeRecord> records = mapper.readValue(in, listType);
      if (records == null) {
        throw new DataLoadException(
            "Dataset file is empty: " + kind.fileName(), Map.of("location", location));
      }
      log.debug("Read {} records from {}", records.size(), kind.fileName());
      return records;
    } catch (IOException e) {
      throw new DataLoadException(
          "Failed to read dataset file " + kind.fileName(),
          Map.of("location", location, "kind", kind.name()),
          e);
    }
  }

  private InputStream open(String fileName) throws IOException {
    if (location.startsWith("classpath:")) {
      String base = location.substring("classpath:".length());
      if (base.startsWith("/")) base = base.substring(1);
      String resource = base.isEmpty() ? fileName : base + "/" + fileName;
      InputStream in = classLoader.getResourceAsStream(resource);
      if (in == null) {
        throw new DataLoadException(
            "Dataset file not found on classpath: " + resource, Map.of("location", location));
      }
      return in;
    }
    Path dir = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    Path file = dir.resolve(fileName);
    if (!Files.isRegularFile(file)) {
      throw new DataLoadException(
          "Dataset file not found: " + file.toAbsolutePath(), Map.of("location", location));
    }
    return Files.newInputStream(file);
  }

  private void validate(ContentKind kind, KnowledgeRecord record) {
    if (record == null) {
      fail(kind, "?", "null entry");
    }
    String key = record.key();
    if (isBlank(key)) {
      fail(kind, "?", kind == ContentKind.GOVERNANCE ? "missing feature" : "missing id");
    }
    if (isBlank(record.title())) {
      fail(kind, key, "missing title");
    }
    switch (kind) {
      case BEST_PRACTICE -> {
        BestPractice bp = (BestPractice) record;
        requireCategory(kind, key, bp.category());
        if (bp.difficulty() == null) fail(kind, key, "missing difficulty");
      }
      case SNIPPET -> {
        Snippet snippet = (Snippet) record;
        if (snippet.language() == null) fail(kind, key, "missing language");
      }
      case TROUBLESHOOTING ->
          requireCategory(kind, key, ((TroubleshootingGuide) record).category());
      case TIP -> requireCategory(kind, key, ((Tip) record).category());
      case GOVERNANCE -> {
        GovernanceEntry entry = (GovernanceEntry) record;
        if (entry.minimumZone() == null) fail(kind, key, "missing minimum_zone");
        for (String zone : entry.zones().keySet()) {
          try {
            GovernanceZone.fromWireName(zone);
          } catch (IllegalArgumentException e) {
            fail(kind, key, "unknown zone '" + zone + "'");
          }
        }
      }
    }
  }

  private static void requireCategory(ContentKind kind, String key, String category) {
    if (isBlank(category)) fail(kind, key, "missing category");
  }

  private static void fail(ContentKind kind, String key, String problem) {
    throw new DataLoadException(
        "Invalid %s record '%s': %s".formatted(kind.displayName(), key, problem),
        Map.of("kind", kind.name(), "key", key));
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
