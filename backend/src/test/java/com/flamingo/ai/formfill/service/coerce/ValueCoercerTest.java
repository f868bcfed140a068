package com.flamingo.ai.formfill.service.coerce;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldKind;
import com.flamingo.ai.formfill.domain.form.FieldOption;
import com.flamingo.ai.formfill.exception.IncoercibleValueException;
import com.flamingo.ai.formfill.exception.NoMatchingOptionException;
import com.flamingo.ai.formfill.exception.UnknownDateFormatException;
import com.flamingo.ai.formfill.service.match.AttributeKey;
import com.flamingo.ai.formfill.service.match.AttributeValue;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ValueCoercerTest {

  private ValueCoercer coercer;

  @BeforeEach
  void setUp() {
    coercer = new ValueCoercer(new FormFillConfig());
  }

  @Nested
  @DisplayName("Text fields")
  class TextFields {

    @Test
    void shouldTruncateToMaxLength() {
      FieldDescriptor field = field(FieldKind.TEXT).toBuilder().maxLength(4).build();

      CoercedValue value = coercer.coerce(value(AttributeKey.FULL_NAME, "Jane Doe"), field);

      assertThat(value.asText()).isEqualTo("Jane");
    }

    @Test
    void shouldReformatDateToMaskedTextField() {
      FieldDescriptor field =
          field(FieldKind.TEXT).toBuilder().dateFormatHint("MM/DD/YYYY").build();

      CoercedValue value = coercer.coerce(value(AttributeKey.EDUCATION_END_DATE, "2019-05"), field);

      assertThat(value.asText()).isEqualTo("05/01/2019");
    }

    @Test
    void shouldKeepDatePrecisionWithoutHint() {
      CoercedValue value =
          coercer.coerce(value(AttributeKey.EDUCATION_END_DATE, "Sep 2019"), field(FieldKind.TEXT));

      assertThat(value.asText()).isEqualTo("2019-09");
    }

    @Test
    void shouldKeepUnparseableAndOpenEndedDatesAsWritten() {
      FieldDescriptor field = field(FieldKind.TEXT);

      assertThat(coercer.coerce(value(AttributeKey.EXPERIENCE_END_DATE, "Present"), field).asText())
          .isEqualTo("Present");
      CoercedValue seasonal =
          coercer.coerce(value(AttributeKey.EXPERIENCE_END_DATE, "Summer 2019"), field);
      assertThat(seasonal.asText()).isEqualTo("Summer 2019");
    }
  }

  @Nested
  @DisplayName("Native date fields")
  class DateFields {

    @Test
    void shouldUseIsoDateByDefault() {
      CoercedValue value =
          coercer.coerce(value(AttributeKey.EDUCATION_END_DATE, "Sep 2019"), field(FieldKind.DATE));

      assertThat(value.asText()).isEqualTo("2019-09-01");
    }

    @Test
    void shouldExpandYearToFirstOfJanuary() {
      CoercedValue value =
          coercer.coerce(value(AttributeKey.EDUCATION_END_DATE, "2019"), field(FieldKind.DATE));

      assertThat(value.asText()).isEqualTo("2019-01-01");
    }

    @Test
    void shouldFollowMonthInputType() {
      FieldDescriptor field = field(FieldKind.DATE).toBuilder().dateFormatHint("month").build();

      CoercedValue value =
          coercer.coerce(value(AttributeKey.EDUCATION_END_DATE, "5/2019"), field);

      assertThat(value.asText()).isEqualTo("2019-05");
    }

    @Test
    void shouldRejectOpenEndedDate() {
      assertThatThrownBy(
              () ->
                  coercer.coerce(
                      value(AttributeKey.EXPERIENCE_END_DATE, "Present"), field(FieldKind.DATE)))
          .isInstanceOf(IncoercibleValueException.class)
          .isNotInstanceOf(UnknownDateFormatException.class);
    }

    @Test
    void shouldRejectUnknownDateShape() {
      assertThatThrownBy(
              () ->
                  coercer.coerce(
                      value(AttributeKey.EXPERIENCE_END_DATE, "someday"), field(FieldKind.DATE)))
          .isInstanceOf(UnknownDateFormatException.class)
          .hasMessageContaining("someday");
    }
  }

  @Nested
  @DisplayName("Choice fields")
  class ChoiceFields {

    private final List<FieldOption> degrees =
        List.of(FieldOption.of("bs", "Bachelor's"), FieldOption.of("ms", "Master's"));

    @Test
    void shouldSelectBestScoringOption() {
      FieldDescriptor field = field(FieldKind.SINGLE_SELECT).toBuilder().options(degrees).build();

      CoercedValue value =
          coercer.coerce(value(AttributeKey.EDUCATION_DEGREE, "Master of Arts"), field);

      assertThat(value.values()).containsExactly("ms");
    }

    @Test
    void shouldMatchOptionValueWhenTextDiffers() {
      FieldDescriptor field =
          field(FieldKind.RADIO_GROUP).toBuilder()
              .options(List.of(FieldOption.of("MBA", "Business"), FieldOption.of("JD", "Law")))
              .build();

      CoercedValue value = coercer.coerce(value(AttributeKey.EDUCATION_DEGREE, "MBA"), field);

      assertThat(value.values()).containsExactly("MBA");
    }

    @Test
    void shouldFailWhenNoOptionIsCloseEnough() {
      FieldDescriptor field = field(FieldKind.SINGLE_SELECT).toBuilder().options(degrees).build();

      assertThatThrownBy(
              () -> coercer.coerce(value(AttributeKey.EDUCATION_DEGREE, "Associate"), field))
          .isInstanceOf(NoMatchingOptionException.class)
          .extracting(e -> ((NoMatchingOptionException) e).getKind())
          .isEqualTo("NoMatchingOption");
    }

    @Test
    void shouldSelectEveryMatchingSkill() {
      // Given
      FieldDescriptor field =
          field(FieldKind.MULTI_SELECT).toBuilder()
              .options(
                  List.of(
                      FieldOption.of("java", "Java"),
                      FieldOption.of("kotlin", "Kotlin"),
                      FieldOption.of("python", "Python")))
              .build();
      AttributeValue skills =
          new AttributeValue(
              AttributeKey.SKILLS, "skills", "Java, Python, Go", List.of("Java", "Python", "Go"));

      // When
      CoercedValue value = coercer.coerce(skills, field);

      // Then
      assertThat(value.values()).containsExactly("java", "python");
    }
  }

  @Test
  void shouldReadYesNoWordsForCheckbox() {
    FieldDescriptor field = field(FieldKind.CHECKBOX);

    assertThat(coercer.coerce(value(AttributeKey.SKILLS, "Yes"), field).asToggle()).isTrue();
    assertThat(coercer.coerce(value(AttributeKey.SKILLS, "no"), field).asToggle()).isFalse();
    assertThatThrownBy(() -> coercer.coerce(value(AttributeKey.SKILLS, "maybe"), field))
        .isInstanceOf(IncoercibleValueException.class);
  }

  private static AttributeValue value(AttributeKey key, String text) {
    return AttributeValue.of(key, key.key(), text);
  }

  private static FieldDescriptor field(FieldKind kind) {
    return FieldDescriptor.builder().id("f1").kind(kind).label("Field").build();
  }
}
