package com.flamingo.ai.formfill.exception;

/** Exception thrown when caller-supplied aliases name an attribute key that does not exist. */
public class UnknownAttributeException extends FormFillException {

  private final String attribute;

  public UnknownAttributeException(String attribute) {
    super("Unknown profile attribute: " + attribute, "Unknown profile attribute: " + attribute);
    this.attribute = attribute;
  }

  public String getAttribute() {
    return attribute;
  }
}
