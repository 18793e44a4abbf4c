package com.gentoro.mcsguide.exception;

import java.util.Map;

/**
 * The knowledge dataset could not be loaded. Always fatal: the service never starts serving with a
 * partially loaded store.
 */
public class DataLoadException extends McsGuideException {
  public DataLoadException(String message) {
    super(McsGuideErrorCode.DATA_LOAD_ERROR, message);
  }

  public DataLoadException(String message, Map<String, ?> context) {
    super(McsGuideErrorCode.DATA_LOAD_ERROR, message, context);
  }

  public DataLoadException(String message, Map<String, ?> context, Throwable cause) {
    super(McsGuideErrorCode.DATA_LOAD_ERROR, message, context, cause);
  }
}
