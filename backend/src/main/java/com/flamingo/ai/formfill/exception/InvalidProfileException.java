package com.flamingo.ai.formfill.exception;

/** Exception thrown when a profile lacks the identity fields required to fill a form. */
public class InvalidProfileException extends FormFillException {

  private final String attribute;

  public InvalidProfileException(String attribute, String message) {
    super("Invalid profile: " + message, message);
    this.attribute = attribute;
  }

  public String getAttribute() {
    return attribute;
  }
}
