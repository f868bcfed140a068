package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.domain.form.FieldKind;
import java.util.EnumSet;
import java.util.Set;

/** What a profile attribute means, and which field kinds can take it. */
public enum SemanticType {
  NAME(EnumSet.of(FieldKind.TEXT)),
  EMAIL(EnumSet.of(FieldKind.TEXT, FieldKind.EMAIL)),
  PHONE(EnumSet.of(FieldKind.TEXT, FieldKind.TEL)),
  TEXT(
      EnumSet.of(
          FieldKind.TEXT, FieldKind.TEXTAREA, FieldKind.SINGLE_SELECT, FieldKind.RADIO_GROUP)),
  LONG_TEXT(EnumSet.of(FieldKind.TEXT, FieldKind.TEXTAREA)),
  DATE(EnumSet.of(FieldKind.DATE, FieldKind.TEXT)),
  DEGREE(EnumSet.of(FieldKind.TEXT, FieldKind.SINGLE_SELECT, FieldKind.RADIO_GROUP)),
  LIST(EnumSet.of(FieldKind.TEXT, FieldKind.TEXTAREA, FieldKind.MULTI_SELECT)),
  HISTORY(EnumSet.of(FieldKind.TEXTAREA));

  private final Set<FieldKind> compatibleKinds;

  SemanticType(Set<FieldKind> compatibleKinds) {
    this.compatibleKinds = compatibleKinds;
  }

  /**
   * Type-compatibility veto applied after scoring.
   *
   * @param kind the target field kind
   * @return true if a value of this type may be written into the kind
   */
  public boolean isCompatibleWith(FieldKind kind) {
    return compatibleKinds.contains(kind);
  }
}
