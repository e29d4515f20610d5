package com.gentoro.wordhint.solver;

import com.gentoro.wordhint.exception.ConfigException;
import java.util.Locale;

/** Whether the pool of words worth guessing follows the answers as they narrow. */
public enum GuessPoolMode {
  /** The pool is seeded at reset and never filtered afterwards. */
  FIXED,
  /** The pool receives every clue the answers receive. */
  NARROWING;

  public static GuessPoolMode fromConfig(String value) {
    if (value == null || value.isBlank()) {
      return FIXED;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException(
          "Invalid solver.guess-pool value '%s', expected 'fixed' or 'narrowing'".formatted(value),
          e);
    }
  }
}
