package com.flamingo.ai.formfill.page.googleform;

import java.util.List;

/**
 * Parsed structure of a Google Form.
 *
 * @param formUrl the view URL the form was loaded from
 * @param responseUrl the URL answers are posted to
 * @param questions answerable questions in form order
 * @param pageCount number of page breaks
 * @param collectsEmail whether the form asks for the respondent's email address
 */
public record GoogleFormDefinition(
    String formUrl,
    String responseUrl,
    List<GoogleFormQuestion> questions,
    int pageCount,
    boolean collectsEmail) {

  public GoogleFormDefinition {
    questions = List.copyOf(questions);
  }
}
