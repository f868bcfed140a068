package com.flamingo.ai.formfill.exception;

/** Exception thrown when a remote form definition cannot be fetched or submitted. */
public class FormSourceException extends FormFillException {

  public FormSourceException(String message) {
    super(message, "The form could not be loaded. Please check the link and try again.");
  }

  public FormSourceException(String message, Throwable cause) {
    super(message, "The form could not be loaded. Please check the link and try again.", cause);
  }
}
