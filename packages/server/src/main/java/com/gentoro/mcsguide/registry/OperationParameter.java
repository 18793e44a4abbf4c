package com.gentoro.mcsguide.registry;

import java.util.List;

/**
 * A single string argument of an operation.
 *
 * @param allowedValues closed set the value is documented against; empty when free text
 */
public record OperationParameter(
    String name,
    Location location,
    boolean required,
    String description,
    List<String> allowedValues) {

  public enum Location {
    PATH,
    QUERY,
    /** Tool argument, carried in the MCP {@code tools/call} arguments object. */
    ARGUMENT
  }

  public OperationParameter {
    allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    if (location == Location.PATH && !required) {
      throw new IllegalArgumentException("Path parameter '" + name + "' must be required");
    }
  }

  public static OperationParameter path(String name, String description) {
    return new OperationParameter(name, Location.PATH, true, description, List.of());
  }

  public static OperationParameter query(String name, String description, String... allowed) {
    return new OperationParameter(name, Location.QUERY, false, description, List.of(allowed));
  }

  public static OperationParameter argument(
      String name, boolean required, String description, String... allowed) {
    return new OperationParameter(name, Location.ARGUMENT, required, description, List.of(allowed));
  }
}
