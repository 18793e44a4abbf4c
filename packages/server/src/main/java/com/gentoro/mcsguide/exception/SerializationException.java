package com.gentoro.mcsguide.exception;

/** JSON serialization or deserialization error. */
public class SerializationException extends McsGuideException {
  public SerializationException(String message) {
    super(McsGuideErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(McsGuideErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
