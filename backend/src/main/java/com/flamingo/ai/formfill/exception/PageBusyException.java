package com.flamingo.ai.formfill.exception;

/** Exception thrown when a second fill run targets a page that another run currently owns. */
public class PageBusyException extends FormFillException {

  private final String pageId;

  public PageBusyException(String pageId) {
    super("Page is already being filled: " + pageId, "This form is already being filled");
    this.pageId = pageId;
  }

  public String getPageId() {
    return pageId;
  }
}
