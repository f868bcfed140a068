package com.flamingo.ai.formfill.exception;

/** Exception thrown when a date cannot be parsed or no target date pattern applies. */
public class UnknownDateFormatException extends IncoercibleValueException {

  public UnknownDateFormatException(String fieldId, String message) {
    super(fieldId, message);
  }

  @Override
  public String getKind() {
    return "UnknownDateFormat";
  }
}
