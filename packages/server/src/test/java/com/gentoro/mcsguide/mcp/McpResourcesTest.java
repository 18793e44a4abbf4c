package com.gentoro.mcsguide.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.mcsguide.content.ContentKind;
import com.gentoro.mcsguide.content.ContentLoader;
import com.gentoro.mcsguide.content.ContentStore;
import com.gentoro.mcsguide.utility.JacksonUtility;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class McpResourcesTest {

  private ContentStore store;
  private McpResources.ResourceSet resources;

  @BeforeEach
  void setUp() {
    store = new ContentLoader("classpath:fixtures/data").load();
    resources = McpResources.build(store);
  }

  @Test
  void everyRecordIsAddressable() {
    int total = store.counts().values().stream().mapToInt(Integer::intValue).sum();
    assertEquals(total, resources.resources().size());
    assertEquals(total, resources.handlers().size());

    List<String> uris = resources.resources().stream().map(McpSchema.Resource::uri).toList();
    assertTrue(uris.contains("bestpractice://bp-001"));
    assertTrue(uris.contains("snippet://snip-001"));
    assertTrue(uris.contains("troubleshooting://ts-002"));
    assertTrue(uris.contains("tip://tip-001"));
    assertTrue(uris.contains("governance://http-connector"));
  }

  @Test
  void readReturnsJsonAndMarkdown() throws Exception {
    McpSchema.ReadResourceResult result =
        resources.handlers().get("snippet://snip-001").handle("snippet://snip-001");

    assertEquals(2, result.contents().size());
    McpSchema.TextResourceContents json =
        (McpSchema.TextResourceContents) result.contents().get(0);
    McpSchema.TextResourceContents markdown =
        (McpSchema.TextResourceContents) result.contents().get(1);

    assertEquals("application/json", json.mimeType());
    assertEquals("text/markdown", markdown.mimeType());
    assertEquals("snippet://snip-001", json.uri());

    JsonNode expected =
        JacksonUtility.toTree(store.require(ContentKind.SNIPPET, "snip-001"));
    assertEquals(expected, JacksonUtility.getJsonMapper().readTree(json.text()));
    assertTrue(markdown.text().startsWith("# Check for an empty variable"));
  }
}
