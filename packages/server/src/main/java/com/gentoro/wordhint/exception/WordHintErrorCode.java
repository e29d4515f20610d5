package com.gentoro.wordhint.exception;

/** Stable error codes surfaced in logs and HTTP error bodies. */
public enum WordHintErrorCode {
  INPUT_LENGTH_MISMATCH,
  INVALID_CHARACTER,
  DICTIONARY_LOAD_FAILURE,
  CONFIG_ERROR,
  NETWORK_ERROR,
  STATE_ERROR,
  UNKNOWN
}
