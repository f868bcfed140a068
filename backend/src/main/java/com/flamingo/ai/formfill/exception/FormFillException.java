package com.flamingo.ai.formfill.exception;

/** Base exception of the form fill engine. Carries a message that is safe to show to users. */
public class FormFillException extends RuntimeException {

  private final String userMessage;

  public FormFillException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public FormFillException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
