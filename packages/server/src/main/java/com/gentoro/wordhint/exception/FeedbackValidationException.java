package com.gentoro.wordhint.exception;

/**
 * Rejected guess, feedback or seed letter. Raised before the session is touched, so a failed call
 * leaves the candidate sets exactly as they were.
 */
public class FeedbackValidationException extends WordHintException {
  public FeedbackValidationException(WordHintErrorCode code, String message) {
    super(code, message);
  }

  public static FeedbackValidationException lengthMismatch(
      String field, String value, int expected) {
    return (FeedbackValidationException)
        new FeedbackValidationException(
                WordHintErrorCode.INPUT_LENGTH_MISMATCH,
                "%s must have exactly %d characters, got %d"
                    .formatted(field, expected, value == null ? 0 : value.length()))
            .withContext("field", field)
            .withContext("value", value);
  }

  public static FeedbackValidationException invalidCharacter(String field, String value, char c) {
    return (FeedbackValidationException)
        new FeedbackValidationException(
                WordHintErrorCode.INVALID_CHARACTER,
                "%s contains unsupported character '%s'".formatted(field, c))
            .withContext("field", field)
            .withContext("value", value);
  }
}
