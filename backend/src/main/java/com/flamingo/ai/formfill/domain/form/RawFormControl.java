package com.flamingo.ai.formfill.domain.form;

import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Loosely-typed snapshot of one form control as reported by a page. Attribute names are lower
 * case. The extractor turns these into {@link FieldDescriptor}s.
 *
 * @param handle opaque element handle assigned by the page
 * @param tagName element tag, lower case
 * @param attributes raw element attributes
 * @param captionText text of an associated label element
 * @param labelledByText text referenced through aria-labelledby
 * @param groupCaption caption of the enclosing group (fieldset legend, radiogroup label)
 * @param precedingText nearest preceding text in the same visual group
 * @param visible whether the control is rendered
 * @param currentValue value already present on the page, empty when none
 * @param checked checked state of radios and checkboxes
 * @param options options of a select element
 */
@Builder
public record RawFormControl(
    String handle,
    String tagName,
    Map<String, String> attributes,
    String captionText,
    String labelledByText,
    String groupCaption,
    String precedingText,
    boolean visible,
    String currentValue,
    boolean checked,
    List<FieldOption> options) {

  public RawFormControl {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    options = options == null ? List.of() : List.copyOf(options);
  }

  /** Returns an attribute value, or null when absent. */
  public String attribute(String name) {
    return attributes.get(name);
  }

  /** Whether a boolean attribute is present. */
  public boolean hasAttribute(String name) {
    return attributes.containsKey(name);
  }
}
