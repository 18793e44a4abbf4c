package com.gentoro.mcsguide.openapi;

import com.gentoro.mcsguide.content.ContentKind;
import com.gentoro.mcsguide.content.model.Difficulty;
import com.gentoro.mcsguide.content.model.GovernanceZone;
import com.gentoro.mcsguide.content.model.SnippetLanguage;
import com.gentoro.mcsguide.registry.OperationParameter;
import com.gentoro.mcsguide.registry.OperationRegistry;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.BooleanSchema;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Describes the REST operations of an {@link OperationRegistry} as an OpenAPI 3.0 document.
 *
 * <p>The document is deliberately flat so that tool registration systems with a restricted schema
 * dialect can import it: every schema is inlined (no {@code $ref}, no {@code components.schemas})
 * and no schema is of type {@code array}. List-valued fields are declared as strings holding
 * comma-separated values; ordered resolution steps as newline-separated text.
 */
public class OpenApiDocumentGenerator {
  static final String SECURITY_SCHEME = "ApiKeyAuth";

  private final OperationRegistry registry;
  private final String basePath;
  private final String apiKeyHeader;
  private final String title;
  private final String version;

  public OpenApiDocumentGenerator(
      OperationRegistry registry,
      String basePath,
      String apiKeyHeader,
      String title,
      String version) {
    this.registry = registry;
    this.basePath = basePath;
    this.apiKeyHeader = apiKeyHeader;
    this.title = title;
    this.version = version;
  }

  public OpenAPI generate() {
    OpenAPI openApi =
        new OpenAPI()
            .info(
                new Info()
                    .title(title)
                    .version(version)
                    .description(
                        "Read-only knowledge base of Copilot Studio best practices, code snippets,"
                            + " troubleshooting guides, tips and governance zone requirements."))
            .components(
                new Components()
                    .addSecuritySchemes(
                        SECURITY_SCHEME,
                        new SecurityScheme()
                            .type(SecurityScheme.Type.APIKEY)
                            .in(SecurityScheme.In.HEADER)
                            .name(apiKeyHeader)))
            .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME));

    Paths paths = new Paths();
    for (com.gentoro.mcsguide.registry.Operation op :
        registry.operations(com.gentoro.mcsguide.registry.Operation.Surface.REST)) {
      paths.addPathItem(basePath + op.pathTemplate(), new PathItem().get(describe(op)));
    }
    openApi.paths(paths);

    for (ContentKind kind : ContentKind.values()) {
      openApi.addTagsItem(new Tag().name(kind.pathSegment()).description(kind.displayName()));
    }
    return openApi;
  }

  private Operation describe(com.gentoro.mcsguide.registry.Operation op) {
    Operation operation =
        new Operation()
            .operationId(op.name())
            .summary(op.description())
            .addTagsItem(op.kind().pathSegment());
    for (OperationParameter p : op.parameters()) {
      StringSchema schema = new StringSchema();
      if (!p.allowedValues().isEmpty()) {
        schema._enum(p.allowedValues());
      }
      operation.addParametersItem(
          new Parameter()
              .name(p.name())
              .in(p.location() == OperationParameter.Location.PATH ? "path" : "query")
              .required(p.required())
              .description(p.description())
              .schema(schema));
    }

    Schema<?> body =
        op.shape() == com.gentoro.mcsguide.registry.Operation.Shape.COLLECTION
            ? collectionSchema(op.kind())
            : recordSchema(op.kind());
    ApiResponses responses =
        new ApiResponses()
            .addApiResponse("200", json("Successful response", body))
            .addApiResponse("401", json("Invalid or missing API key", errorSchema()));
    if (op.shape() == com.gentoro.mcsguide.registry.Operation.Shape.RECORD) {
      responses.addApiResponse("404", json("Not found", errorSchema()));
    }
    return operation.responses(responses);
  }

  private static ApiResponse json(String description, Schema<?> schema) {
    return new ApiResponse()
        .description(description)
        .content(new Content().addMediaType("application/json", new MediaType().schema(schema)));
  }

  private static Schema<?> errorSchema() {
    return new ObjectSchema().addProperties("detail", new StringSchema());
  }

  private static Schema<?> collectionSchema(ContentKind kind) {
    return new ObjectSchema()
        .addProperties(
            "results",
            new StringSchema()
                .description(
                    ("Matching %s records in dataset order, each shaped like the single record"
                            + " response")
                        .formatted(kind.displayName().toLowerCase())))
        .addProperties("total", new IntegerSchema().description("Number of results"));
  }

  static Schema<?> recordSchema(ContentKind kind) {
    ObjectSchema schema = new ObjectSchema();
    schema.description(kind.displayName());
    switch (kind) {
      case BEST_PRACTICE -> {
        schema
            .addProperties("id", new StringSchema())
            .addProperties("title", new StringSchema())
            .addProperties("category", new StringSchema())
            .addProperties("description", new StringSchema())
            .addProperties("rationale", new StringSchema())
            .addProperties("example_good", new StringSchema())
            .addProperties("example_bad", new StringSchema())
            .addProperties("difficulty", enumSchema(Difficulty.values(), Difficulty::wireName))
            .addProperties("tags", commaSeparated("Tags"));
      }
      case SNIPPET -> {
        schema
            .addProperties("id", new StringSchema())
            .addProperties("title", new StringSchema())
            .addProperties(
                "language", enumSchema(SnippetLanguage.values(), SnippetLanguage::wireName))
            .addProperties("category", new StringSchema())
            .addProperties("description", new StringSchema())
            .addProperties("code", new StringSchema())
            .addProperties("explanation", new StringSchema())
            .addProperties("use_case", new StringSchema())
            .addProperties("tags", commaSeparated("Tags"));
      }
      case TROUBLESHOOTING -> {
        schema
            .addProperties("id", new StringSchema())
            .addProperties("title", new StringSchema())
            .addProperties("category", new StringSchema())
            .addProperties("symptoms", commaSeparated("Observed symptoms"))
            .addProperties("causes", commaSeparated("Possible causes"))
            .addProperties(
                "resolution_steps",
                new StringSchema()
                    .description(
                        "Ordered resolution steps, newline-separated, each"
                            + " 'step. action: details'"))
            .addProperties("tags", commaSeparated("Tags"));
      }
      case TIP -> {
        schema
            .addProperties("id", new StringSchema())
            .addProperties("title", new StringSchema())
            .addProperties("category", new StringSchema())
            .addProperties("tip", new StringSchema())
            .addProperties("why_it_matters", new StringSchema())
            .addProperties("tags", commaSeparated("Tags"));
      }
      case GOVERNANCE -> {
        ObjectSchema policy = new ObjectSchema();
        policy
            .addProperties("available", new BooleanSchema())
            .addProperties("reason", new StringSchema())
            .addProperties("requirements", commaSeparated("Requirements to use the feature"));
        ObjectSchema zones = new ObjectSchema();
        zones.description(
            "Policy per zone, keyed by "
                + String.join(", ", names(GovernanceZone.values(), GovernanceZone::wireName)));
        zones.additionalProperties(policy);
        schema
            .addProperties("feature", new StringSchema())
            .addProperties("display_name", new StringSchema())
            .addProperties(
                "minimum_zone", enumSchema(GovernanceZone.values(), GovernanceZone::wireName))
            .addProperties("zones", zones)
            .addProperties("justification_template", new StringSchema());
      }
    }
    return schema;
  }

  private static Schema<?> commaSeparated(String description) {
    return new StringSchema().description(description + ", comma-separated");
  }

  private static <E> Schema<?> enumSchema(E[] values, Function<E, String> wireName) {
    return new StringSchema()._enum(names(values, wireName));
  }

  private static <E> List<String> names(E[] values, Function<E, String> wireName) {
    return Arrays.stream(values).map(wireName).toList();
  }
}
