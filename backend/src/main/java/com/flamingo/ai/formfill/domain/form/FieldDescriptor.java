package com.flamingo.ai.formfill.domain.form;

import java.util.List;
import lombok.Builder;

/**
 * Normalized description of one fillable form element. Created fresh by every extraction and never
 * mutated.
 *
 * @param id opaque handle into the live page
 * @param kind classified field kind
 * @param label best-effort caption, empty when none was found
 * @param labelSource rule that resolved the label
 * @param placeholder raw placeholder attribute
 * @param name raw name attribute
 * @param domId raw id attribute
 * @param required whether the page marks the field as required
 * @param options choices, empty unless the kind is a choice kind
 * @param maxLength declared maximum length, or null
 * @param dateFormatHint date pattern hint, or null
 * @param documentOrder position among the extracted fields
 */
@Builder(toBuilder = true)
public record FieldDescriptor(
    String id,
    FieldKind kind,
    String label,
    LabelSource labelSource,
    String placeholder,
    String name,
    String domId,
    boolean required,
    List<FieldOption> options,
    Integer maxLength,
    String dateFormatHint,
    int documentOrder) {

  public FieldDescriptor {
    label = label == null ? "" : label;
    labelSource = labelSource == null ? LabelSource.NONE : labelSource;
    options = options == null ? List.of() : List.copyOf(options);
  }
}
