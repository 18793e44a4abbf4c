package com.gentoro.mcsguide.exception;

/** Network-level error while binding or running the HTTP listener. */
public class NetworkException extends McsGuideException {
  public NetworkException(String message) {
    super(McsGuideErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(McsGuideErrorCode.NETWORK_ERROR, message, cause);
  }
}
