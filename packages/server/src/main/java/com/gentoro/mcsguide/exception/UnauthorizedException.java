package com.gentoro.mcsguide.exception;

/** Missing or invalid credential. */
public class UnauthorizedException extends McsGuideException {
  public UnauthorizedException(String message) {
    super(McsGuideErrorCode.UNAUTHENTICATED, message);
  }

  public UnauthorizedException(String message, Throwable cause) {
    super(McsGuideErrorCode.UNAUTHENTICATED, message, cause);
  }
}
