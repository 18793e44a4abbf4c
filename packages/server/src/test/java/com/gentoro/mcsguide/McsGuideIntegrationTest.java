package com.gentoro.mcsguide;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.mcsguide.mcp.McpServer;
import com.gentoro.mcsguide.utility.JacksonUtility;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

/**
 * Boots the whole server on an ephemeral port with the fixture dataset and drives it over HTTP,
 * including a raw MCP Streamable HTTP session.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisplayName("McsGuide over HTTP")
class McsGuideIntegrationTest {
  private static final String API_KEY = "test-key-1";
  private static final String PROTOCOL_VERSION = "2025-03-26";

  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final AtomicInteger ids = new AtomicInteger();
  private McsGuide app;
  private HttpClient client;
  private String baseUrl;

  @BeforeAll
  void start() {
    app = new McsGuide(new String[] {"--config-file", "classpath:application-test.yaml"});
    app.initialize();
    assertTrue(app.httpServer().isRunning());
    baseUrl = "http://127.0.0.1:" + app.httpServer().getPort();
    client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
  }

  @AfterAll
  void stop() {
    if (app != null) app.shutdown();
  }

  private HttpResponse<String> get(String path, String apiKey) throws Exception {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(URI.create(baseUrl + path)).timeout(Duration.ofSeconds(10)).GET();
    if (apiKey != null) builder.header("X-API-Key", apiKey);
    return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private JsonNode json(HttpResponse<String> response) throws IOException {
    return mapper.readTree(response.body());
  }

  // ---------------------------------------------------------------- plain HTTP

  @Test
  void healthNeedsNoCredentials() throws Exception {
    HttpResponse<String> response = get("/health", null);
    assertEquals(200, response.statusCode());
    JsonNode body = json(response);
    assertEquals("healthy", body.get("status").asText());
    assertTrue(body.get("data_loaded").asBoolean());
    assertEquals(3, body.get("counts").get("best_practices").asInt());
    assertEquals(2, body.get("counts").get("governance").asInt());
    assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
  }

  @Test
  void mcpEndpointAndServerNameComeFromConfiguration() {
    assertEquals("/mcp", McpServer.endpoint(app.configuration()));
    assertEquals("mcs-guide-test", McpServer.serverName(app.configuration()));
  }

  @Test
  void preflightNeedsNoCredentials() throws Exception {
    HttpRequest request =
        HttpRequest.newBuilder(URI.create(baseUrl + "/api/v1/snippets"))
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
            .header("Origin", "https://studio.example.com")
            .header("Access-Control-Request-Method", "GET")
            .build();
    HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
    assertEquals(204, response.statusCode());
    assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
  }

  @Test
  void everythingElseNeedsAValidKey() throws Exception {
    for (String path : List.of("/api/v1/best-practices", "/openapi.json", "/anything")) {
      HttpResponse<String> missing = get(path, null);
      assertEquals(401, missing.statusCode(), path);
      assertEquals("Invalid or missing API key", json(missing).get("detail").asText());
      assertEquals(401, get(path, "wrong").statusCode(), path);
    }
  }

  @Test
  void listEndpointsSearchAndFilter() throws Exception {
    HttpResponse<String> response =
        get("/api/v1/best-practices?q=connector&category=connectors", API_KEY);
    assertEquals(200, response.statusCode());
    JsonNode body = json(response);
    assertEquals(1, body.get("total").asInt());
    assertEquals("bp-001", body.get("results").get(0).get("id").asText());

    JsonNode all = json(get("/api/v1/snippets?language=any", "test-key-2"));
    assertEquals(3, all.get("total").asInt());

    JsonNode none = json(get("/api/v1/best-practices?difficulty=expert", API_KEY));
    assertEquals(0, none.get("total").asInt());
    assertEquals(0, none.get("results").size());
  }

  @Test
  void detailEndpointsReturnRecordOr404() throws Exception {
    JsonNode guide = json(get("/api/v1/troubleshooting/ts-001", API_KEY));
    assertEquals("ts-001", guide.get("id").asText());
    assertEquals(2, guide.get("resolution_steps").size());

    HttpResponse<String> missing = get("/api/v1/troubleshooting/ts-999", API_KEY);
    assertEquals(404, missing.statusCode());
    assertTrue(json(missing).get("detail").asText().contains("ts-999"));

    JsonNode governance = json(get("/api/v1/governance/HTTP%20Connector", API_KEY));
    assertEquals("http-connector", governance.get("feature").asText());
    assertEquals("yellow", governance.get("minimum_zone").asText());
    assertFalse(governance.has("id"));
    assertEquals(404, get("/api/v1/governance/http", API_KEY).statusCode());

    assertEquals(404, get("/api/v1/unknown", API_KEY).statusCode());
  }

  @Test
  void onlyGetIsAllowedOnTheApi() throws Exception {
    HttpRequest request =
        HttpRequest.newBuilder(URI.create(baseUrl + "/api/v1/tips"))
            .header("X-API-Key", API_KEY)
            .POST(HttpRequest.BodyPublishers.ofString("{}"))
            .build();
    assertEquals(405, client.send(request, HttpResponse.BodyHandlers.ofString()).statusCode());
  }

  @Test
  void openApiDocumentIsServedWithAKey() throws Exception {
    HttpResponse<String> response = get("/openapi.json", API_KEY);
    assertEquals(200, response.statusCode());
    JsonNode doc = json(response);
    assertTrue(doc.get("openapi").asText().startsWith("3.0"));
    assertTrue(doc.get("paths").has("/api/v1/tips/{id}"));
  }

  // ---------------------------------------------------------------- MCP

  @Test
  void getOnMcpEndpointIsAStatusProbe() throws Exception {
    HttpResponse<String> response = get("/mcp", null);
    assertEquals(200, response.statusCode());
    JsonNode body = json(response);
    assertEquals("ok", body.get("status").asText());
    assertEquals("mcs-guide-test", body.get("server").asText());
    assertEquals("mcp-streamable-1.0", body.get("protocol").asText());
  }

  @Test
  void mcpSessionListsToolsCallsThemAndReadsResources() throws Exception {
    String session = initialize(true);

    JsonNode tools = rpc(session, "tools/list", mapper.createObjectNode());
    List<String> names = new ArrayList<>();
    tools.get("result").get("tools").forEach(t -> names.add(t.get("name").asText()));
    assertEquals(
        List.of(
            "search_best_practices",
            "get_code_snippet",
            "troubleshoot_issue",
            "get_tips_for_feature",
            "check_governance_zone"),
        names);

    ObjectNode args = mapper.createObjectNode().put("feature", "mcp");
    JsonNode call =
        rpc(
            session,
            "tools/call",
            mapper.createObjectNode().put("name", "check_governance_zone").set("arguments", args));
    JsonNode result = call.get("result");
    assertFalse(result.path("isError").asBoolean(false));
    JsonNode entry = mapper.readTree(result.get("content").get(0).get("text").asText());
    assertEquals("mcp-servers", entry.get("feature").asText());

    JsonNode failed =
        rpc(
            session,
            "tools/call",
            mapper
                .createObjectNode()
                .put("name", "get_code_snippet")
                .set("arguments", mapper.createObjectNode().put("id", "snip-404")));
    assertTrue(failed.get("result").get("isError").asBoolean());

    JsonNode read =
        rpc(
            session,
            "resources/read",
            mapper.createObjectNode().put("uri", "governance://http-connector"));
    JsonNode contents = read.get("result").get("contents");
    assertEquals(2, contents.size());
    assertEquals("application/json", contents.get(0).get("mimeType").asText());
    assertEquals("text/markdown", contents.get(1).get("mimeType").asText());
    assertEquals(
        json(get("/api/v1/governance/http-connector", API_KEY)),
        mapper.readTree(contents.get(0).get("text").asText()));
  }

  @Test
  void mcpPostWithoutAcceptHeaderIsStillServed() throws Exception {
    String session = initialize(false);
    assertNotNull(session);
  }

  @Test
  void snippetToolAndRestReturnTheSameRecord() throws Exception {
    String session = initialize(true);
    JsonNode call =
        rpc(
            session,
            "tools/call",
            mapper
                .createObjectNode()
                .put("name", "get_code_snippet")
                .set("arguments", mapper.createObjectNode().put("id", "snip-001")));
    JsonNode fromTool =
        mapper.readTree(call.get("result").get("content").get(0).get("text").asText());
    JsonNode fromRest = json(get("/api/v1/snippets/snip-001", API_KEY));
    assertEquals(fromRest, fromTool);
  }

  /** Runs initialize plus the initialized notification and returns the session id. */
  private String initialize(boolean sendAccept) throws Exception {
    ObjectNode params = mapper.createObjectNode().put("protocolVersion", PROTOCOL_VERSION);
    params.set("capabilities", mapper.createObjectNode());
    params.set(
        "clientInfo", mapper.createObjectNode().put("name", "integration-test").put("version", "1"));
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(URI.create(baseUrl + "/mcp"))
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", "application/json")
            .header("X-API-Key", API_KEY)
            .POST(HttpRequest.BodyPublishers.ofString(envelope("initialize", params, true)));
    if (sendAccept) builder.header("Accept", "application/json, text/event-stream");
    HttpResponse<String> response =
        client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    assertEquals(200, response.statusCode(), response.body());
    JsonNode init = parseMessage(response.body());
    assertEquals("mcs-guide-test", init.get("result").get("serverInfo").get("name").asText());
    String session = response.headers().firstValue("Mcp-Session-Id").orElse(null);
    assertNotNull(session, "missing session id");

    HttpResponse<String> ack =
        client.send(
            mcpRequest(session, envelope("notifications/initialized", null, false)),
            HttpResponse.BodyHandlers.ofString());
    assertEquals(202, ack.statusCode(), ack.body());
    return session;
  }

  private JsonNode rpc(String session, String method, JsonNode params) throws Exception {
    HttpResponse<String> response =
        client.send(
            mcpRequest(session, envelope(method, params, true)),
            HttpResponse.BodyHandlers.ofString());
    assertEquals(200, response.statusCode(), response.body());
    JsonNode message = parseMessage(response.body());
    assertNull(message.get("error"), () -> message.toString());
    return message;
  }

  private HttpRequest mcpRequest(String session, String body) {
    return HttpRequest.newBuilder(URI.create(baseUrl + "/mcp"))
        .timeout(Duration.ofSeconds(10))
        .header("Content-Type", "application/json")
        .header("Accept", "application/json, text/event-stream")
        .header("X-API-Key", API_KEY)
        .header("Mcp-Session-Id", session)
        .header("MCP-Protocol-Version", PROTOCOL_VERSION)
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();
  }

  private String envelope(String method, JsonNode params, boolean withId) throws IOException {
    ObjectNode node = mapper.createObjectNode().put("jsonrpc", "2.0").put("method", method);
    if (withId) node.put("id", ids.incrementAndGet());
    if (params != null) node.set("params", params);
    return mapper.writeValueAsString(node);
  }

  /** Accepts either a plain JSON body or an SSE stream carrying the message in data lines. */
  private JsonNode parseMessage(String body) throws IOException {
    String trimmed = body.trim();
    if (trimmed.startsWith("{")) {
      return mapper.readTree(trimmed);
    }
    StringBuilder data = new StringBuilder();
    for (String line : trimmed.split("\r?\n")) {
      if (line.startsWith("data:")) {
        data.append(line.substring("data:".length()).trim());
      } else if (line.isBlank() && data.length() > 0) {
        break;
      }
    }
    assertTrue(data.length() > 0, () -> "no SSE data in: " + body);
    return mapper.readTree(data.toString());
  }
}
