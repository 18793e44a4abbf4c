package com.gentoro.mcsguide.registry;

import com.gentoro.mcsguide.content.ContentKind;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, read-only operation over the knowledge base.
 *
 * <p>REST operations carry a path template relative to the API base path (for example {@code
 * /snippets/{id}}); tool operations have none and are addressed by name only.
 */
public record Operation(
    String name,
    Surface surface,
    String pathTemplate,
    ContentKind kind,
    Shape shape,
    String description,
    List<OperationParameter> parameters,
    OperationHandler handler) {

  public enum Surface {
    REST,
    TOOL
  }

  /** Whether the result is a {@code {results, total}} collection or a single record. */
  public enum Shape {
    COLLECTION,
    RECORD
  }

  public Operation {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(surface, "surface");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(handler, "handler");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    if (surface == Surface.REST && (pathTemplate == null || !pathTemplate.startsWith("/"))) {
      throw new IllegalArgumentException("REST operation '" + name + "' needs a path template");
    }
  }

  /**
   * Matches a request path (relative to the API base path) against the template and returns the
   * captured path parameters, or empty when the path does not match.
   */
  public Optional<Map<String, String>> matchPath(String path) {
    if (pathTemplate == null || path == null) return Optional.empty();
    String[] expected = split(pathTemplate);
    String[] actual = split(path);
    if (expected.length != actual.length) return Optional.empty();
    Map<String, String> captured = new LinkedHashMap<>();
    for (int i = 0; i < expected.length; i++) {
      String segment = expected[i];
      if (segment.startsWith("{") && segment.endsWith("}")) {
        if (actual[i].isEmpty()) return Optional.empty();
        captured.put(segment.substring(1, segment.length() - 1), actual[i]);
      } else if (!segment.equals(actual[i])) {
        return Optional.empty();
      }
    }
    return Optional.of(captured);
  }

  private static String[] split(String path) {
    String trimmed = path;
    while (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
    while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return trimmed.isEmpty() ? new String[0] : trimmed.split("/", -1);
  }
}
