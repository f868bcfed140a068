package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import java.util.OptionalDouble;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Scores the placeholder like a label, capped at the placeholder ceiling. */
@Component
@Order(3)
@RequiredArgsConstructor
public class PlaceholderStrategy implements MatchStrategy {

  public static final String NAME = "placeholder";

  private final FormFillConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public OptionalDouble score(AttributeValue attribute, FieldDescriptor field, AliasTable aliases) {
    if (field.placeholder() == null || field.placeholder().isBlank()) {
      return OptionalDouble.empty();
    }
    FormFillConfig.Matching matching = config.getMatching();
    double raw = LabelSimilarityStrategy.bestAliasScore(field.placeholder(), attribute, aliases);
    if (raw < matching.getLabelFloor()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Math.min(raw, matching.getPlaceholderCeiling()));
  }
}
