package com.flamingo.ai.formfill.exception;

/** Exception thrown when a profile value cannot be represented in the target field. */
public class IncoercibleValueException extends FormFillException {

  private final String fieldId;

  public IncoercibleValueException(String fieldId, String message) {
    super(message, "Value could not be converted for this field");
    this.fieldId = fieldId;
  }

  public String getFieldId() {
    return fieldId;
  }

  /** Short error kind used in run reports. */
  public String getKind() {
    return "IncoercibleValue";
  }
}
