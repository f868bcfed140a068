package com.flamingo.ai.formfill.domain.form;

/** Which rule produced a field's label, in resolution priority order. */
public enum LabelSource {
  CAPTION,
  ARIA,
  PLACEHOLDER,
  PRECEDING_TEXT,
  /** Shared name of a radio or checkbox group that has no caption. */
  NAME,
  NONE
}
