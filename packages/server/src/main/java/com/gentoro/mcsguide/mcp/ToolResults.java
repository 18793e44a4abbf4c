package com.gentoro.mcsguide.mcp;

import com.gentoro.mcsguide.utility.JacksonUtility;
import io.modelcontextprotocol.spec.McpSchema;

/** Builds {@code tools/call} results. Payloads are the same JSON the REST API returns. */
final class ToolResults {
  private ToolResults() {}

  static McpSchema.CallToolResult success(Object payload) {
    return McpSchema.CallToolResult.builder()
        .addTextContent(JacksonUtility.toPrettyJson(payload))
        .isError(false)
        .build();
  }

  static McpSchema.CallToolResult error(String message) {
    return McpSchema.CallToolResult.builder().addTextContent(message).isError(true).build();
  }
}
