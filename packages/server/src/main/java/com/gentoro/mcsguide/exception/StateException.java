package com.gentoro.mcsguide.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends McsGuideException {
  public StateException(String message) {
    super(McsGuideErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(McsGuideErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
