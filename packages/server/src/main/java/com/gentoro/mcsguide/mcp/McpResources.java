package com.gentoro.mcsguide.mcp;

import com.gentoro.mcsguide.content.ContentKind;
import com.gentoro.mcsguide.content.ContentStore;
import com.gentoro.mcsguide.content.model.KnowledgeRecord;
import com.gentoro.mcsguide.utility.JacksonUtility;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every record of the store as an MCP resource addressed {@code <scheme>://<key>}, for example
 * {@code snippet://snip-001} or {@code governance://http-connector}.
 *
 * <p>Reading a resource yields two contents for the same URI: the record as JSON (identical to the
 * REST body) and a Markdown rendition.
 */
final class McpResources {
  static final String JSON_MIME = "application/json";
  static final String MARKDOWN_MIME = "text/markdown";

  private McpResources() {}

  /** Static resource list plus per-URI read handlers; usable without a transport. */
  record ResourceSet(List<McpSchema.Resource> resources, Map<String, ResourceHandler> handlers) {}

  @FunctionalInterface
  interface ResourceHandler {
    McpSchema.ReadResourceResult handle(String uri);
  }

  static ResourceSet build(ContentStore store) {
    List<McpSchema.Resource> resources = new ArrayList<>();
    Map<String, ResourceHandler> handlers = new LinkedHashMap<>();

    for (ContentKind kind : ContentKind.values()) {
      for (KnowledgeRecord record : store.all(kind)) {
        String uri = kind.resourceUri(record.key());
        resources.add(
            McpSchema.Resource.builder()
                .uri(uri)
                .name(record.key())
                .description(kind.displayName() + ": " + record.title())
                .mimeType(JSON_MIME)
                .build());

        String json = JacksonUtility.toPrettyJson(record);
        String markdown = MarkdownRenderer.render(record);
        handlers.put(
            uri,
            requested ->
                new McpSchema.ReadResourceResult(
                    List.of(
                        new McpSchema.TextResourceContents(requested, JSON_MIME, json),
                        new McpSchema.TextResourceContents(requested, MARKDOWN_MIME, markdown))));
      }
    }
    return new ResourceSet(resources, handlers);
  }
}
