package com.gentoro.mcsguide.exception;

/**
 * Canonical error codes for the knowledge service. Codes are stable and safe to surface in logs and
 * in structured error details; HTTP and MCP surfaces map them to their own status conventions.
 */
public enum McsGuideErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  UNAUTHENTICATED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  DATA_LOAD_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,
}
