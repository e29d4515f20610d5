package com.gentoro.wordhint.exception;

/** Missing or invalid configuration values. */
public class ConfigException extends WordHintException {
  public ConfigException(String message) {
    super(WordHintErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(WordHintErrorCode.CONFIG_ERROR, message, cause);
  }
}
