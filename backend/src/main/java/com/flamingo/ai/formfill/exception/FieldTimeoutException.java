package com.flamingo.ai.formfill.exception;

import java.time.Duration;

/** Exception thrown when a field did not become interactable within its bounded wait. */
public class FieldTimeoutException extends FieldInteractionException {

  public FieldTimeoutException(String fieldId, Duration timeout, Throwable cause) {
    super(
        fieldId,
        "Field " + fieldId + " not interactable after " + timeout.toMillis() + "ms",
        cause);
  }
}
