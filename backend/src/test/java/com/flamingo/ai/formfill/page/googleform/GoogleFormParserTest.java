package com.flamingo.ai.formfill.page.googleform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.formfill.exception.FormSourceException;
import com.flamingo.ai.formfill.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GoogleFormParserTest {

  private static final String FORM_URL =
      "https://docs.google.com/forms/d/e/1FAIpQLSe-test/viewform?usp=sf_link";

  private GoogleFormParser parser;

  @BeforeEach
  void setUp() {
    parser = new GoogleFormParser(new ObjectMapper());
  }

  @Nested
  class FixtureForm {

    private GoogleFormDefinition definition;

    @BeforeEach
    void parse() {
      definition = parser.parse(FORM_URL, Fixtures.resource("forms/google-form.html"));
    }

    @Test
    void shouldReadAnswerableQuestionsInOrder() {
      assertThat(definition.questions())
          .extracting(GoogleFormQuestion::parameterName)
          .containsExactly(
              "entry.1001", "entry.1002", "entry.1003", "entry.1005", "entry.1006", "entry.1008");
      assertThat(definition.questions())
          .extracting(GoogleFormQuestion::type)
          .containsExactly(
              GoogleFormQuestion.QuestionType.SHORT_ANSWER,
              GoogleFormQuestion.QuestionType.SHORT_ANSWER,
              GoogleFormQuestion.QuestionType.DROPDOWN,
              GoogleFormQuestion.QuestionType.DATE,
              GoogleFormQuestion.QuestionType.CHECKBOXES,
              GoogleFormQuestion.QuestionType.MULTIPLE_CHOICE);
    }

    @Test
    void shouldReadRequiredFlagAndOptions() {
      GoogleFormQuestion name = definition.questions().get(0);
      GoogleFormQuestion degree = definition.questions().get(2);
      GoogleFormQuestion skills = definition.questions().get(4);

      assertThat(name.required()).isTrue();
      assertThat(name.caption()).isEqualTo("Full name");
      assertThat(degree.options()).containsExactly("Bachelor's", "Master's");
      assertThat(skills.options()).containsExactly("Java", "Python", "Go");
    }

    @Test
    void shouldAppendRowNameToCaption() {
      assertThat(definition.questions().get(5).caption()).isEqualTo("Availability: Morning");
    }

    @Test
    void shouldCountPageBreaksAndEmailCollection() {
      assertThat(definition.pageCount()).isEqualTo(1);
      assertThat(definition.collectsEmail()).isTrue();
      assertThat(definition.responseUrl())
          .isEqualTo("https://docs.google.com/forms/d/e/1FAIpQLSe-test/formResponse");
    }
  }

  @ParameterizedTest
  @CsvSource({
    "https://docs.google.com/forms/d/e/X/viewform?usp=sf_link,"
        + " https://docs.google.com/forms/d/e/X/formResponse",
    "https://docs.google.com/forms/d/e/X/, https://docs.google.com/forms/d/e/X/formResponse",
    "https://docs.google.com/forms/d/e/X, https://docs.google.com/forms/d/e/X/formResponse",
    "https://docs.google.com/forms/d/e/X/formResponse,"
        + " https://docs.google.com/forms/d/e/X/formResponse"
  })
  void shouldDeriveResponseUrl(String formUrl, String expected) {
    assertThat(GoogleFormParser.responseUrl(formUrl)).isEqualTo(expected);
  }

  @Test
  void shouldFailWithoutFormData() {
    assertThatThrownBy(() -> parser.parse(FORM_URL, "<html><body>Sign in</body></html>"))
        .isInstanceOf(FormSourceException.class)
        .hasMessageContaining("No form data");
  }

  @Test
  void shouldFailOnMalformedFormData() {
    String html = "<script>var FB_PUBLIC_LOAD_DATA_ = [null, [;</script>";

    assertThatThrownBy(() -> parser.parse(FORM_URL, html))
        .isInstanceOf(FormSourceException.class)
        .hasMessageContaining("Malformed");
  }

  @Test
  void shouldFailWhenQuestionsAreMissing() {
    String html = "<script>var FB_PUBLIC_LOAD_DATA_ = [null, null];</script>";

    assertThatThrownBy(() -> parser.parse(FORM_URL, html))
        .isInstanceOf(FormSourceException.class)
        .hasMessageContaining("No questions");
  }
}
