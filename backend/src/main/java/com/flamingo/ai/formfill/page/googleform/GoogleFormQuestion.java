package com.flamingo.ai.formfill.page.googleform;

import java.util.List;

/**
 * One answerable entry of a Google Form.
 *
 * @param entryId numeric entry id, submitted as {@code entry.<id>}
 * @param title question title
 * @param subTitle row name of multi-row questions, or null
 * @param type question type
 * @param required whether the form requires an answer
 * @param options choice texts, empty for free-text questions
 */
public record GoogleFormQuestion(
    String entryId,
    String title,
    String subTitle,
    QuestionType type,
    boolean required,
    List<String> options) {

  public GoogleFormQuestion {
    options = options == null ? List.of() : List.copyOf(options);
  }

  /** Form parameter name of the answer. */
  public String parameterName() {
    return "entry." + entryId;
  }

  /** Title with the row name appended, as shown to respondents. */
  public String caption() {
    return subTitle == null || subTitle.isBlank() ? title : title + ": " + subTitle;
  }

  /** Google Forms question types the engine can answer. */
  public enum QuestionType {
    SHORT_ANSWER(0),
    PARAGRAPH(1),
    MULTIPLE_CHOICE(2),
    DROPDOWN(3),
    CHECKBOXES(4),
    DATE(9);

    private final int typeId;

    QuestionType(int typeId) {
      this.typeId = typeId;
    }

    /** Returns the type for a raw type id, or null when the type is not answerable. */
    static QuestionType fromTypeId(int typeId) {
      for (QuestionType type : values()) {
        if (type.typeId == typeId) {
          return type;
        }
      }
      return null;
    }
  }
}
