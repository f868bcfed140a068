package com.flamingo.ai.formfill.service.coerce;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldKind;
import com.flamingo.ai.formfill.domain.form.FieldOption;
import com.flamingo.ai.formfill.exception.IncoercibleValueException;
import com.flamingo.ai.formfill.exception.NoMatchingOptionException;
import com.flamingo.ai.formfill.exception.UnknownDateFormatException;
import com.flamingo.ai.formfill.service.match.AttributeValue;
import com.flamingo.ai.formfill.service.match.SemanticType;
import com.flamingo.ai.formfill.service.match.TextSimilarity;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts a profile value into the representation a field kind needs.
 *
 * <ul>
 *   <li>text, textarea, email, tel: the text, truncated to the declared maximum length
 *   <li>date: reformatted to the pattern inferred from the field's date hint, ISO by default
 *   <li>single select and radio group: the value of the best scoring option
 *   <li>multi select and checkbox groups: values of every option some item matches
 *   <li>checkbox: a boolean read from yes/no style words
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ValueCoercer {

  private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1", "on");
  private static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "0", "off");

  private final FormFillConfig config;

  /**
   * Coerces one value for one field.
   *
   * @param attribute the profile value
   * @param field the target field
   * @return the coerced value
   * @throws IncoercibleValueException if the value cannot be represented; subtypes name the
   *     reason
   */
  public CoercedValue coerce(AttributeValue attribute, FieldDescriptor field) {
    FieldKind kind = field.kind();
    return switch (kind) {
      case TEXT, EMAIL, TEL, TEXTAREA -> CoercedValue.text(kind, text(attribute, field));
      case DATE -> CoercedValue.text(kind, nativeDate(attribute, field));
      case SINGLE_SELECT, RADIO_GROUP ->
          CoercedValue.selection(kind, List.of(bestOption(attribute, field)));
      case MULTI_SELECT -> CoercedValue.selection(kind, matchingOptions(attribute, field));
      case CHECKBOX -> CoercedValue.toggle(toggle(attribute, field));
    };
  }

  private String text(AttributeValue attribute, FieldDescriptor field) {
    String text = attribute.text();
    if (attribute.semanticType() == SemanticType.DATE && !DateValueFormatter.isOpenEnded(text)) {
      text = textDate(text, field);
    }
    Integer maxLength = field.maxLength();
    if (maxLength != null && text.length() > maxLength) {
      log.debug("Truncating value for field {} to {} characters", field.id(), maxLength);
      text = text.substring(0, maxLength);
    }
    return text;
  }

  /** Text fields only reformat dates they can parse and keep anything else as written. */
  private String textDate(String text, FieldDescriptor field) {
    Optional<ParsedDate> parsed = DateValueFormatter.parse(text);
    if (parsed.isEmpty()) {
      return text;
    }
    if (field.dateFormatHint() == null) {
      return DateValueFormatter.isoText(parsed.get());
    }
    return DateValueFormatter.patternFor(field.dateFormatHint())
        .map(pattern -> parsed.get().date().format(pattern))
        .orElseGet(() -> DateValueFormatter.isoText(parsed.get()));
  }

  private String nativeDate(AttributeValue attribute, FieldDescriptor field) {
    String text = attribute.text();
    if (DateValueFormatter.isOpenEnded(text)) {
      throw new IncoercibleValueException(
          field.id(), "Open-ended date '" + text + "' has no calendar value");
    }
    ParsedDate parsed =
        DateValueFormatter.parse(text)
            .orElseThrow(
                () ->
                    new UnknownDateFormatException(
                        field.id(), "Unrecognized date '" + text + "'"));
    DateTimeFormatter pattern =
        DateValueFormatter.patternFor(field.dateFormatHint())
            .orElseGet(
                () -> {
                  log.debug(
                      "No pattern for date hint '{}' on field {}, using ISO",
                      field.dateFormatHint(),
                      field.id());
                  return DateValueFormatter.ISO_DATE;
                });
    return parsed.date().format(pattern);
  }

  private String bestOption(AttributeValue attribute, FieldDescriptor field) {
    FieldOption best = null;
    double bestScore = 0.0;
    for (FieldOption option : field.options()) {
      double score = optionScore(attribute.text(), option);
      if (score > bestScore) {
        best = option;
        bestScore = score;
      }
    }
    if (best == null || bestScore < config.getMatching().getOptionFloor()) {
      throw new NoMatchingOptionException(field.id(), attribute.text(), bestScore);
    }
    log.debug(
        "Field {} option '{}' chosen for '{}' (score {})",
        field.id(),
        best.value(),
        attribute.text(),
        String.format(Locale.ROOT, "%.2f", bestScore));
    return best.value();
  }

  private List<String> matchingOptions(AttributeValue attribute, FieldDescriptor field) {
    double floor = config.getMatching().getOptionFloor();
    List<String> selected = new ArrayList<>();
    double bestScore = 0.0;
    for (FieldOption option : field.options()) {
      double score =
          attribute.items().stream().mapToDouble(item -> optionScore(item, option)).max().orElse(0);
      bestScore = Math.max(bestScore, score);
      if (score >= floor) {
        selected.add(option.value());
      }
    }
    if (selected.isEmpty()) {
      throw new NoMatchingOptionException(field.id(), attribute.text(), bestScore);
    }
    return selected;
  }

  private boolean toggle(AttributeValue attribute, FieldDescriptor field) {
    String word = attribute.text().trim().toLowerCase(Locale.ROOT);
    if (TRUE_WORDS.contains(word)) {
      return true;
    }
    if (FALSE_WORDS.contains(word)) {
      return false;
    }
    throw new IncoercibleValueException(
        field.id(), "'" + attribute.text() + "' is not a yes/no value");
  }

  static double optionScore(String value, FieldOption option) {
    return Math.max(
        TextSimilarity.optionScore(value, option.displayText()),
        TextSimilarity.optionScore(value, option.value()));
  }
}
