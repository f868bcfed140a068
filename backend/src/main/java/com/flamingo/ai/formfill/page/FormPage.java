package com.flamingo.ai.formfill.page;

import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.RawFormControl;
import java.time.Duration;
import java.util.List;

/**
 * Handle to one loaded form page, supplied by the browser-session collaborator. A handle is used
 * by at most one fill run at a time.
 */
public interface FormPage {

  /**
   * Stable identifier of the page, used to keep concurrent runs off the same page.
   *
   * @return the page identifier
   */
  String pageId();

  /**
   * Reads every form control of the page in document order. Read-only apart from stamping element
   * handles.
   *
   * @param timeout bounded wait for the document to be ready
   * @return raw controls in document order
   * @throws com.flamingo.ai.formfill.exception.StaleDocumentException if the page is gone
   */
  List<RawFormControl> inspectControls(Duration timeout);

  /**
   * Waits until the field can receive input.
   *
   * @param field the target field
   * @param timeout bounded wait
   * @throws com.flamingo.ai.formfill.exception.FieldTimeoutException when the wait expires
   */
  void awaitInteractable(FieldDescriptor field, Duration timeout);

  /**
   * Sets the field to the given value using the mechanism its kind needs.
   *
   * @param field the target field
   * @param value the coerced value
   * @throws com.flamingo.ai.formfill.exception.FieldInteractionException if the field cannot be set
   */
  void apply(FieldDescriptor field, CoercedValue value);

  /**
   * Fires the input and change notifications page scripts listen for.
   *
   * @param field the field that was just set
   */
  void dispatchChangeEvents(FieldDescriptor field);

  /**
   * Reads the current value or selection of the field.
   *
   * @param field the field to read
   * @return the observed values in the same shape as {@link CoercedValue#values()}
   */
  List<String> read(FieldDescriptor field);
}
