package com.gentoro.mcsguide.registry;

import static com.gentoro.mcsguide.registry.OperationParameter.argument;
import static com.gentoro.mcsguide.registry.OperationParameter.path;
import static com.gentoro.mcsguide.registry.OperationParameter.query;

import com.gentoro.mcsguide.content.ContentKind;
import com.gentoro.mcsguide.content.model.Difficulty;
import com.gentoro.mcsguide.content.model.SnippetLanguage;
import com.gentoro.mcsguide.exception.NotFoundException;
import com.gentoro.mcsguide.registry.Operation.Shape;
import com.gentoro.mcsguide.registry.Operation.Surface;
import com.gentoro.mcsguide.search.SearchEngine;
import com.gentoro.mcsguide.search.SearchRequest;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Registers the REST and tool operations of the knowledge base against a {@link SearchEngine}. */
public final class KnowledgeOperations {

  private static final String[] DIFFICULTIES =
      Arrays.stream(Difficulty.values()).map(Difficulty::wireName).toArray(String[]::new);
  private static final String[] LANGUAGES =
      Arrays.stream(SnippetLanguage.values()).map(SnippetLanguage::wireName).toArray(String[]::new);

  private KnowledgeOperations() {}

  public static OperationRegistry createRegistry(SearchEngine engine) {
    OperationRegistry.Builder builder = OperationRegistry.builder();
    registerRest(builder, engine);
    registerTools(builder, engine);
    return builder.build();
  }

  static void registerRest(OperationRegistry.Builder builder, SearchEngine engine) {
    builder
        .register(
            list(
                "listBestPractices",
                ContentKind.BEST_PRACTICE,
                "Search curated best practices by text, category and difficulty.",
                engine,
                List.of(
                    query("q", "Text searched in title, description, rationale and tags"),
                    query("category", "Exact category, e.g. security"),
                    query("difficulty", "Skill level", DIFFICULTIES))))
        .register(detail("getBestPractice", ContentKind.BEST_PRACTICE, engine))
        .register(
            list(
                "listSnippets",
                ContentKind.SNIPPET,
                "Search code snippets by text, language and category.",
                engine,
                List.of(
                    query("q", "Text searched in title, description, use case, code and tags"),
                    query("language", "Snippet language; 'any' means no constraint", LANGUAGES),
                    query("category", "Exact category"))))
        .register(detail("getSnippet", ContentKind.SNIPPET, engine))
        .register(
            list(
                "listTroubleshootingGuides",
                ContentKind.TROUBLESHOOTING,
                "Search troubleshooting guides by symptom text and category.",
                engine,
                List.of(
                    query("q", "Text searched in title, symptoms, causes and tags"),
                    query("category", "Exact category"))))
        .register(detail("getTroubleshootingGuide", ContentKind.TROUBLESHOOTING, engine))
        .register(
            list(
                "listTips",
                ContentKind.TIP,
                "List tips, optionally narrowed by category or text.",
                engine,
                List.of(
                    query("category", "Exact category, e.g. testing"),
                    query("q", "Text searched in title, category, tip and tags"))))
        .register(detail("getTip", ContentKind.TIP, engine))
        .register(
            new Operation(
                "getGovernance",
                Surface.REST,
                "/governance/{feature}",
                ContentKind.GOVERNANCE,
                Shape.RECORD,
                "Governance zone requirements for a feature such as http-connector.",
                List.of(path("feature", "Feature name; spaces and underscores count as hyphens")),
                args -> engine.governance(args.get("feature"))));
  }

  static void registerTools(OperationRegistry.Builder builder, SearchEngine engine) {
    builder
        .register(
            tool(
                "search_best_practices",
                ContentKind.BEST_PRACTICE,
                "Search curated Copilot Studio best practices. Returns every matching practice with"
                    + " its rationale and difficulty.",
                List.of(
                    argument("query", true, "What to look for, e.g. 'error handling'"),
                    argument("category", false, "Restrict to one category"),
                    argument("difficulty", false, "Restrict to one skill level", DIFFICULTIES)),
                args ->
                    engine.search(
                        ContentKind.BEST_PRACTICE,
                        new SearchRequest(
                            args.get("query"),
                            filters(
                                "category", args.get("category"),
                                "difficulty", args.get("difficulty"))))))
        .register(
            tool(
                "get_code_snippet",
                ContentKind.SNIPPET,
                "Get copy-paste ready code snippets for Copilot Studio (power-fx, yaml, json or"
                    + " any). Pass an id for one snippet, or a query to search.",
                List.of(
                    argument("query", false, "What the snippet should do"),
                    argument("language", false, "Snippet language", LANGUAGES),
                    argument("id", false, "Snippet id, e.g. snip-001")),
                args -> {
                  if (args.containsKey("id")) {
                    return engine.lookup(ContentKind.SNIPPET, args.get("id"));
                  }
                  return engine.search(
                      ContentKind.SNIPPET,
                      new SearchRequest(
                          args.get("query"), filters("language", args.get("language"))));
                }))
        .register(
            tool(
                "troubleshoot_issue",
                ContentKind.TROUBLESHOOTING,
                "Get step-by-step troubleshooting for Copilot Studio issues. Describe the problem"
                    + " or error message, or pass a guide id.",
                List.of(
                    argument("issue", false, "Problem description or error message"),
                    argument("id", false, "Guide id, e.g. ts-001")),
                args -> {
                  if (args.containsKey("id")) {
                    return engine.lookup(ContentKind.TROUBLESHOOTING, args.get("id"));
                  }
                  return engine.search(
                      ContentKind.TROUBLESHOOTING, SearchRequest.of(args.get("issue")));
                }))
        .register(
            tool(
                "get_tips_for_feature",
                ContentKind.TIP,
                "Get tips and tricks for a Copilot Studio feature like topics, testing or"
                    + " authoring.",
                List.of(argument("feature", true, "Feature or area name")),
                args -> engine.search(ContentKind.TIP, SearchRequest.of(args.get("feature")))))
        .register(
            new Operation(
                "check_governance_zone",
                Surface.TOOL,
                null,
                ContentKind.GOVERNANCE,
                Shape.RECORD,
                "Check which governance zone a Copilot Studio feature requires, e.g."
                    + " http-connector or mcp-servers.",
                List.of(argument("feature", true, "Feature name or part of it")),
                args ->
                    engine
                        .findGovernance(args.get("feature"))
                        .orElseThrow(
                            () ->
                                new NotFoundException(
                                    "No governance information found for '%s'."
                                        .formatted(args.get("feature"))))));
  }

  private static Operation list(
      String name,
      ContentKind kind,
      String description,
      SearchEngine engine,
      List<OperationParameter> parameters) {
    return new Operation(
        name,
        Surface.REST,
        "/" + kind.pathSegment(),
        kind,
        Shape.COLLECTION,
        description,
        parameters,
        args -> {
          Map<String, String> filters = new LinkedHashMap<>(args);
          String text = filters.remove("q");
          return engine.search(kind, new SearchRequest(text, filters));
        });
  }

  private static Operation detail(String name, ContentKind kind, SearchEngine engine) {
    return new Operation(
        name,
        Surface.REST,
        "/" + kind.pathSegment() + "/{id}",
        kind,
        Shape.RECORD,
        "Full detail of one %s by id.".formatted(kind.displayName().toLowerCase()),
        List.of(path("id", kind.displayName() + " id")),
        args -> engine.lookup(kind, args.get("id")));
  }

  private static Operation tool(
      String name,
      ContentKind kind,
      String description,
      List<OperationParameter> parameters,
      OperationHandler handler) {
    return new Operation(
        name, Surface.TOOL, null, kind, Shape.COLLECTION, description, parameters, handler);
  }

  private static Map<String, String> filters(String... pairs) {
    Map<String, String> filters = new LinkedHashMap<>();
    for (int i = 0; i + 1 < pairs.length; i += 2) {
      if (pairs[i + 1] != null) {
        filters.put(pairs[i], pairs[i + 1]);
      }
    }
    return filters;
  }
}
