package com.gentoro.wordhint.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link WordHintException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof WordHintException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        WordHintErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static WordHintException rethrowIfUnchecked(
      Throwable t, Function<Throwable, WordHintException> supplier) {
    if (t instanceof WordHintException) {
      return (WordHintException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
