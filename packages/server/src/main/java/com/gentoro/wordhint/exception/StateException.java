package com.gentoro.wordhint.exception;

/** A component was used in a state that does not allow the requested operation. */
public class StateException extends WordHintException {
  public StateException(String message) {
    super(WordHintErrorCode.STATE_ERROR, message);
  }
}
