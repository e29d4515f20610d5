package com.gentoro.wordhint.exception;

import java.time.Instant;
import java.util.Map;

/** Serializable snapshot of an error, used for logging and API responses. */
public record ErrorDetails(
    String type,
    String message,
    WordHintErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
