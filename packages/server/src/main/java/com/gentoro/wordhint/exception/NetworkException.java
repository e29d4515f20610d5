package com.gentoro.wordhint.exception;

/** Failures while binding or running the HTTP listener. */
public class NetworkException extends WordHintException {
  public NetworkException(String message) {
    super(WordHintErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(WordHintErrorCode.NETWORK_ERROR, message, cause);
  }
}
