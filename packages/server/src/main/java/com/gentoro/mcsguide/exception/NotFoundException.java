package com.gentoro.mcsguide.exception;

import java.util.Map;

/** Record requested by id (or governance feature) was not found. */
public class NotFoundException extends McsGuideException {
  public NotFoundException(String message) {
    super(McsGuideErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(McsGuideErrorCode.NOT_FOUND, message, context);
  }
}
