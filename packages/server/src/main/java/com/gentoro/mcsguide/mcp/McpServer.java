package com.gentoro.mcsguide.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mcsguide.content.ContentStore;
import com.gentoro.mcsguide.exception.ExceptionUtil;
import com.gentoro.mcsguide.exception.NotFoundException;
import com.gentoro.mcsguide.exception.ValidationException;
import com.gentoro.mcsguide.registry.Operation;
import com.gentoro.mcsguide.registry.OperationParameter;
import com.gentoro.mcsguide.registry.OperationRegistry;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * MCP Streamable HTTP endpoint backed by the official MCP SDK.
 *
 * <p>Every tool operation of the {@link OperationRegistry} becomes an MCP tool whose input schema
 * is derived from the operation parameters, and every record of the {@link ContentStore} becomes a
 * resource (see {@link McpResources}).
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> – servlet path; default "/mcp"
 *   <li><b>http.mcp.server.name</b> – server name reported to clients; default "mcs-guide"
 *   <li><b>http.mcp.server.version</b> – default "1.0.0"
 *   <li><b>http.mcp.server.instructions</b> – text returned in the initialize response
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.mcsguide.logging.LoggingService.getLogger(McpServer.class);

  static final String DEFAULT_ENDPOINT = "/mcp";
  static final String DEFAULT_SERVER_NAME = "mcs-guide";

  private final Configuration configuration;
  private final OperationRegistry registry;
  private final ContentStore store;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(Configuration configuration, OperationRegistry registry, ContentStore store) {
    this.configuration = configuration;
    this.registry = registry;
    this.store = store;
  }

  /** Build the MCP server and mount its servlet on the shared context handler. */
  public void register(ServletContextHandler context) {
    String endpoint = endpoint(configuration);
    String serverName = serverName(configuration);
    String serverVersion = configuration.getString("http.mcp.server.version", "1.0.0");
    String instructions = configuration.getString("http.mcp.server.instructions", "");

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(configuration.getBoolean("http.mcp.disallow-delete", false))
            .build();

    McpResources.ResourceSet resourceSet = McpResources.build(store);
    List<McpServerFeatures.SyncResourceSpecification> resources = new ArrayList<>();
    for (McpSchema.Resource resource : resourceSet.resources()) {
      McpResources.ResourceHandler handler = resourceSet.handlers().get(resource.uri());
      resources.add(
          new McpServerFeatures.SyncResourceSpecification(
              resource, (exchange, request) -> handler.handle(request.uri())));
    }

    var spec =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(
                McpSchema.ServerCapabilities.builder()
                    .tools(false)
                    .resources(false, false)
                    .build())
            .tools(toolSpecifications())
            .resources(resources);
    if (instructions != null && !instructions.isBlank()) {
      spec.instructions(instructions.trim());
    }
    mcpServer = spec.build();

    ServletHolder holder = new ServletHolder(servletTransport);
    // Streamable HTTP answers with SSE from an async context
    holder.setAsyncSupported(true);
    context.addServlet(holder, endpoint);

    log.info(
        "MCP servlet registered at {} ({} tools, {} resources)",
        endpoint,
        registry.operations(Operation.Surface.TOOL).size(),
        resources.size());
  }

  List<McpServerFeatures.SyncToolSpecification> toolSpecifications() {
    List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();
    for (Operation operation : registry.operations(Operation.Surface.TOOL)) {
      tools.add(
          McpServerFeatures.SyncToolSpecification.builder()
              .tool(
                  McpSchema.Tool.builder()
                      .name(operation.name())
                      .description(operation.description())
                      .inputSchema(inputSchema(operation))
                      .build())
              .callHandler((exchange, request) -> callTool(operation, request.arguments()))
              .build());
    }
    return tools;
  }

  static McpSchema.JsonSchema inputSchema(Operation operation) {
    Map<String, Object> properties = new LinkedHashMap<>();
    List<String> required = new ArrayList<>();
    for (OperationParameter parameter : operation.parameters()) {
      Map<String, Object> property = new LinkedHashMap<>();
      property.put("type", "string");
      if (parameter.description() != null) {
        property.put("description", parameter.description());
      }
      if (!parameter.allowedValues().isEmpty()) {
        property.put("enum", parameter.allowedValues());
      }
      properties.put(parameter.name(), property);
      if (parameter.required()) {
        required.add(parameter.name());
      }
    }
    return new McpSchema.JsonSchema(
        "object", properties, required, false, Collections.emptyMap(), Collections.emptyMap());
  }

  McpSchema.CallToolResult callTool(Operation operation, Map<String, Object> arguments) {
    Map<String, String> args = new LinkedHashMap<>();
    if (arguments != null) {
      arguments.forEach(
          (name, value) -> {
            if (value != null) args.put(name, value.toString());
          });
    }
    try {
      return ToolResults.success(registry.invoke(operation.name(), args));
    } catch (NotFoundException | ValidationException e) {
      log.debug("Tool {} rejected: {}", operation.name(), e.getMessage());
      return ToolResults.error(e.getMessage());
    } catch (RuntimeException e) {
      log.error("Failed to handle MCP tool request {}", operation.name(), e);
      return ToolResults.error(
          Objects.requireNonNullElse(e.getMessage(), ExceptionUtil.formatCompactStackTrace(e)));
    }
  }

  public static String endpoint(Configuration configuration) {
    String endpoint = configuration.getString("http.mcp.endpoint", DEFAULT_ENDPOINT);
    if (endpoint == null || endpoint.isBlank()) return DEFAULT_ENDPOINT;
    endpoint = endpoint.trim();
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }

  public static String serverName(Configuration configuration) {
    String name = configuration.getString("http.mcp.server.name", DEFAULT_SERVER_NAME);
    return name == null || name.isBlank() ? DEFAULT_SERVER_NAME : name.trim();
  }

  /** Clean up MCP transport/resources. */
  @Override
  public void close() {
    try {
      if (mcpServer != null) {
        mcpServer.closeGracefully();
      }
    } catch (IllegalStateException e) {
      // Reactor refuses block() on its own non-blocking threads
      log.debug("MCP server closed from a non-blocking thread, skipping graceful close", e);
    } finally {
      mcpServer = null;
      servletTransport = null;
    }
  }
}
