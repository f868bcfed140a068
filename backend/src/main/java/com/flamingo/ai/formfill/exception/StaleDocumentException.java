package com.flamingo.ai.formfill.exception;

/** Exception thrown when the form document vanished or its handle is no longer usable. */
public class StaleDocumentException extends FormFillException {

  private final String pageId;

  public StaleDocumentException(String pageId, String message) {
    super(message, "The form page is no longer available");
    this.pageId = pageId;
  }

  public StaleDocumentException(String pageId, String message, Throwable cause) {
    super(message, "The form page is no longer available", cause);
    this.pageId = pageId;
  }

  public String getPageId() {
    return pageId;
  }
}
