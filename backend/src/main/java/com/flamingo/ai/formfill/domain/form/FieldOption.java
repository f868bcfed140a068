package com.flamingo.ai.formfill.domain.form;

/**
 * One choice of a choice field.
 *
 * @param value the submitted value
 * @param displayText the text a user sees
 * @param handle element handle of the member input for grouped radios and checkboxes, else null
 */
public record FieldOption(String value, String displayText, String handle) {

  public static FieldOption of(String value, String displayText) {
    return new FieldOption(value, displayText, null);
  }
}
