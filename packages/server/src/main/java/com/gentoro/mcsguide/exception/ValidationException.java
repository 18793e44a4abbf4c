package com.gentoro.mcsguide.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends McsGuideException {
  public ValidationException(String message) {
    super(McsGuideErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(McsGuideErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
