package com.gentoro.wordhint.exception;

/** The word list could not be read, or produced no usable words. */
public class DictionaryException extends WordHintException {
  public DictionaryException(String message) {
    super(WordHintErrorCode.DICTIONARY_LOAD_FAILURE, message);
  }

  public DictionaryException(String message, Throwable cause) {
    super(WordHintErrorCode.DICTIONARY_LOAD_FAILURE, message, cause);
  }
}
