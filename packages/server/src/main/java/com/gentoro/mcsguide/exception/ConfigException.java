package com.gentoro.mcsguide.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends McsGuideException {
  public ConfigException(String message) {
    super(McsGuideErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(McsGuideErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
