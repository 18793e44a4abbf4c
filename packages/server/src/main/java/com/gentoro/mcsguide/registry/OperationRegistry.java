package com.gentoro.mcsguide.registry;

import com.gentoro.mcsguide.exception.NotFoundException;
import com.gentoro.mcsguide.exception.ValidationException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of every operation the service exposes, built once at startup and handed to the
 * REST surface, the MCP surface and the OpenAPI generator.
 */
public final class OperationRegistry {

  private final Map<String, Operation> operations;

  private OperationRegistry(Map<String, Operation> operations) {
    this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Collection<Operation> all() {
    return operations.values();
  }

  public List<Operation> operations(Operation.Surface surface) {
    return operations.values().stream().filter(op -> op.surface() == surface).toList();
  }

  public Optional<Operation> get(String name) {
    return Optional.ofNullable(operations.get(name));
  }

  /**
   * Finds the REST operation serving {@code path} and returns it with its captured path
   * parameters.
   */
  public Optional<Route> route(String path) {
    for (Operation op : operations(Operation.Surface.REST)) {
      Optional<Map<String, String>> captured = op.matchPath(path);
      if (captured.isPresent()) {
        return Optional.of(new Route(op, captured.get()));
      }
    }
    return Optional.empty();
  }

  /**
   * Runs an operation after checking its required parameters. Arguments the operation does not
   * declare are dropped.
   *
   * @throws NotFoundException for an unknown operation name or an unknown record
   * @throws ValidationException when a required parameter is missing or blank
   */
  public Object invoke(String name, Map<String, String> arguments) {
    Operation op =
        get(name).orElseThrow(() -> new NotFoundException("Unknown operation: " + name));
    Map<String, String> accepted = new LinkedHashMap<>();
    for (OperationParameter parameter : op.parameters()) {
      String value = arguments == null ? null : arguments.get(parameter.name());
      if (value == null || value.isBlank()) {
        if (parameter.required()) {
          throw new ValidationException(
              "Missing required parameter '%s' for %s".formatted(parameter.name(), name));
        }
        continue;
      }
      accepted.put(parameter.name(), value);
    }
    return op.handler().handle(Collections.unmodifiableMap(accepted));
  }

  /** A matched REST operation and the path parameters it captured. */
  public record Route(Operation operation, Map<String, String> pathParameters) {}

  public static final class Builder {
    private final Map<String, Operation> operations = new LinkedHashMap<>();
    private boolean built;

    private Builder() {}

    public Builder register(Operation operation) {
      if (built) {
        throw new IllegalStateException("Registry already built");
      }
      if (operations.putIfAbsent(operation.name(), operation) != null) {
        throw new IllegalArgumentException("Duplicate operation name: " + operation.name());
      }
      return this;
    }

    public OperationRegistry build() {
      built = true;
      return new OperationRegistry(operations);
    }
  }
}
