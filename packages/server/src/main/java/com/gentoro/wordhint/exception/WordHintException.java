package com.gentoro.wordhint.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all application exceptions. Carries an error code and an optional map of
 * context values that end up in {@link ErrorDetails}.
 */
public class WordHintException extends RuntimeException {
  private final WordHintErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public WordHintException(WordHintErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public WordHintException(WordHintErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public WordHintErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public WordHintException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
