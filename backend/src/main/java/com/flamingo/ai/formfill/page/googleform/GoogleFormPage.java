package com.flamingo.ai.formfill.page.googleform;

import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldKind;
import com.flamingo.ai.formfill.domain.form.FieldOption;
import com.flamingo.ai.formfill.domain.form.RawFormControl;
import com.flamingo.ai.formfill.exception.FieldInteractionException;
import com.flamingo.ai.formfill.page.FormPage;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Form page over a parsed Google Form. Answers are kept in memory and turned into the form
 * parameters Google Forms expects by {@link #formData()}.
 */
public class GoogleFormPage implements FormPage {

  static final String EMAIL_PARAMETER = "emailAddress";

  private final String pageId;
  private final GoogleFormDefinition definition;
  private final Map<String, GoogleFormQuestion> questionsByParameter = new LinkedHashMap<>();
  private final Map<String, List<String>> answers = new HashMap<>();

  public GoogleFormPage(String pageId, GoogleFormDefinition definition) {
    this.pageId = pageId;
    this.definition = definition;
    for (GoogleFormQuestion question : definition.questions()) {
      questionsByParameter.put(question.parameterName(), question);
    }
  }

  @Override
  public String pageId() {
    return pageId;
  }

  public GoogleFormDefinition definition() {
    return definition;
  }

  @Override
  public List<RawFormControl> inspectControls(Duration timeout) {
    List<RawFormControl> controls = new ArrayList<>();
    for (GoogleFormQuestion question : definition.questions()) {
      switch (question.type()) {
        case SHORT_ANSWER -> controls.add(input(question, "text"));
        case DATE -> controls.add(input(question, "date"));
        case PARAGRAPH -> controls.add(control(question, "textarea", Map.of()).build());
        case DROPDOWN ->
            controls.add(
                control(question, "select", Map.of())
                    .options(question.options().stream().map(o -> FieldOption.of(o, o)).toList())
                    .build());
        case MULTIPLE_CHOICE -> controls.addAll(members(question, "radio"));
        case CHECKBOXES -> controls.addAll(members(question, "checkbox"));
      }
    }
    if (definition.collectsEmail()) {
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put("type", "email");
      attributes.put("name", EMAIL_PARAMETER);
      attributes.put("required", "");
      controls.add(
          RawFormControl.builder()
              .handle(EMAIL_PARAMETER)
              .tagName("input")
              .attributes(attributes)
              .captionText("Email Address")
              .visible(true)
              .currentValue(String.join(",", answers.getOrDefault(EMAIL_PARAMETER, List.of())))
              .build());
    }
    return controls;
  }

  @Override
  public void awaitInteractable(FieldDescriptor field, Duration timeout) {
    parameterOf(field);
  }

  @Override
  public void apply(FieldDescriptor field, CoercedValue value) {
    String parameter = parameterOf(field);
    if (field.kind() == FieldKind.CHECKBOX) {
      GoogleFormQuestion question = questionsByParameter.get(parameter);
      answers.put(parameter, value.asToggle() ? List.of(question.options().get(0)) : List.of());
    } else {
      answers.put(parameter, value.values());
    }
  }

  @Override
  public void dispatchChangeEvents(FieldDescriptor field) {
    // answers are held in memory; nothing listens for changes
  }

  @Override
  public List<String> read(FieldDescriptor field) {
    List<String> answer = answers.getOrDefault(parameterOf(field), List.of());
    if (field.kind() == FieldKind.CHECKBOX) {
      return List.of(Boolean.toString(!answer.isEmpty()));
    }
    if (field.kind().isTextLike() || field.kind() == FieldKind.DATE) {
      return answer.isEmpty() ? List.of("") : answer;
    }
    return answer;
  }

  /**
   * Builds the submission parameters from the applied answers. Dates are split into year, month
   * and day parameters; forms with page breaks also get the page history.
   *
   * @return form parameters for a {@code formResponse} POST
   */
  public MultiValueMap<String, String> formData() {
    MultiValueMap<String, String> data = new LinkedMultiValueMap<>();
    answers.forEach(
        (parameter, values) -> {
          GoogleFormQuestion question = questionsByParameter.get(parameter);
          if (question != null && question.type() == GoogleFormQuestion.QuestionType.DATE) {
            addDate(data, parameter, values);
          } else {
            values.forEach(value -> data.add(parameter, value));
          }
        });
    if (definition.pageCount() > 0) {
      data.add(
          "pageHistory",
          IntStream.rangeClosed(0, definition.pageCount())
              .mapToObj(Integer::toString)
              .collect(Collectors.joining(",")));
    }
    return data;
  }

  private static void addDate(
      MultiValueMap<String, String> data, String parameter, List<String> values) {
    if (values.isEmpty() || values.get(0).isBlank()) {
      return;
    }
    try {
      LocalDate date = LocalDate.parse(values.get(0));
      data.add(parameter + "_year", Integer.toString(date.getYear()));
      data.add(parameter + "_month", Integer.toString(date.getMonthValue()));
      data.add(parameter + "_day", Integer.toString(date.getDayOfMonth()));
    } catch (DateTimeParseException e) {
      throw new FieldInteractionException(
          parameter, "Date answer '" + values.get(0) + "' is not an ISO date", e);
    }
  }

  private RawFormControl input(GoogleFormQuestion question, String type) {
    return control(question, "input", Map.of("type", type)).build();
  }

  private RawFormControl.RawFormControlBuilder control(
      GoogleFormQuestion question, String tagName, Map<String, String> extra) {
    Map<String, String> attributes = new LinkedHashMap<>(extra);
    attributes.put("name", question.parameterName());
    if (question.required()) {
      attributes.put("required", "");
    }
    return RawFormControl.builder()
        .handle(question.parameterName())
        .tagName(tagName)
        .attributes(attributes)
        .captionText(question.caption())
        .visible(true)
        .currentValue(
            String.join(",", answers.getOrDefault(question.parameterName(), List.of())));
  }

  private List<RawFormControl> members(GoogleFormQuestion question, String type) {
    List<String> answer = answers.getOrDefault(question.parameterName(), List.of());
    List<RawFormControl> members = new ArrayList<>();
    for (int i = 0; i < question.options().size(); i++) {
      String option = question.options().get(i);
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put("type", type);
      attributes.put("name", question.parameterName());
      attributes.put("value", option);
      if (question.required()) {
        attributes.put("required", "");
      }
      members.add(
          RawFormControl.builder()
              .handle(question.parameterName() + "#" + i)
              .tagName("input")
              .attributes(attributes)
              .captionText(option)
              .groupCaption(question.caption())
              .visible(true)
              .currentValue("")
              .checked(answer.contains(option))
              .build());
    }
    return members;
  }

  private String parameterOf(FieldDescriptor field) {
    String parameter = field.name();
    if (!questionsByParameter.containsKey(parameter)
        && !(EMAIL_PARAMETER.equals(parameter) && definition.collectsEmail())) {
      throw new FieldInteractionException(field.id(), "Form has no entry " + parameter);
    }
    return parameter;
  }
}
