package com.flamingo.ai.formfill.domain.form;

import java.util.HashSet;
import java.util.List;

/**
 * A value in the representation a field kind needs: one text for text-like and date fields, the
 * chosen option values for choice fields, {@code "true"}/{@code "false"} for a checkbox.
 */
public record CoercedValue(FieldKind kind, List<String> values) {

  public CoercedValue {
    values = values == null ? List.of() : List.copyOf(values);
  }

  public static CoercedValue text(FieldKind kind, String text) {
    return new CoercedValue(kind, List.of(text));
  }

  public static CoercedValue selection(FieldKind kind, List<String> optionValues) {
    return new CoercedValue(kind, optionValues);
  }

  public static CoercedValue toggle(boolean checked) {
    return new CoercedValue(FieldKind.CHECKBOX, List.of(Boolean.toString(checked)));
  }

  /** Returns the single text value, or an empty string. */
  public String asText() {
    return values.isEmpty() ? "" : values.get(0);
  }

  public boolean asToggle() {
    return Boolean.parseBoolean(asText());
  }

  /**
   * Compares with what a page reports after applying this value. Text is compared with line
   * endings normalized; selections are compared as sets.
   *
   * @param observed values read back from the page
   * @return true when the page shows this value
   */
  public boolean matches(List<String> observed) {
    if (observed == null) {
      return false;
    }
    if (kind == FieldKind.MULTI_SELECT) {
      return new HashSet<>(values).equals(new HashSet<>(observed));
    }
    if (kind == FieldKind.CHECKBOX) {
      return observed.size() == 1 && asToggle() == Boolean.parseBoolean(observed.get(0));
    }
    if (observed.size() != 1) {
      return values.isEmpty() && observed.isEmpty();
    }
    return normalizeLineEndings(asText()).equals(normalizeLineEndings(observed.get(0)));
  }

  /** Human-readable form used in reports. */
  public String display() {
    return String.join(", ", values);
  }

  private static String normalizeLineEndings(String text) {
    return text == null ? "" : text.replace("\r\n", "\n");
  }
}
