package com.flamingo.ai.formfill.exception;

/** Exception thrown when a single field cannot be located, set or read on the page. */
public class FieldInteractionException extends FormFillException {

  private final String fieldId;

  public FieldInteractionException(String fieldId, String message) {
    super(message, "The field could not be filled");
    this.fieldId = fieldId;
  }

  public FieldInteractionException(String fieldId, String message, Throwable cause) {
    super(message, "The field could not be filled", cause);
    this.fieldId = fieldId;
  }

  public String getFieldId() {
    return fieldId;
  }
}
