package com.flamingo.ai.formfill.domain.form;

/** Kind of a fillable form field, classified once at extraction time. */
public enum FieldKind {
  TEXT,
  EMAIL,
  TEL,
  TEXTAREA,
  DATE,
  SINGLE_SELECT,
  MULTI_SELECT,
  CHECKBOX,
  RADIO_GROUP;

  /** Whether the field is filled by choosing among options. */
  public boolean isChoice() {
    return this == SINGLE_SELECT || this == MULTI_SELECT || this == RADIO_GROUP;
  }

  /** Whether the field takes free text. */
  public boolean isTextLike() {
    return this == TEXT || this == EMAIL || this == TEL || this == TEXTAREA;
  }
}
