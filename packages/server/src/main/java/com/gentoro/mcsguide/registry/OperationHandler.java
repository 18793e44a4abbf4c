package com.gentoro.mcsguide.registry;

import java.util.Map;

/** Executes an operation against string arguments and returns a JSON-serializable result. */
@FunctionalInterface
public interface OperationHandler {
  Object handle(Map<String, String> arguments);
}
