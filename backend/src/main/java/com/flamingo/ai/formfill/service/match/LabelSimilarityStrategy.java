package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.LabelSource;
import java.util.OptionalDouble;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Scores the field label against the attribute's aliases. Has an opinion only at or above the
 * label floor, and never for labels that were taken from the placeholder.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class LabelSimilarityStrategy implements MatchStrategy {

  public static final String NAME = "labelSimilarity";

  private final FormFillConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public OptionalDouble score(AttributeValue attribute, FieldDescriptor field, AliasTable aliases) {
    if (field.labelSource() == LabelSource.PLACEHOLDER || field.label().isBlank()) {
      return OptionalDouble.empty();
    }
    double best = bestAliasScore(field.label(), attribute, aliases);
    return best >= config.getMatching().getLabelFloor()
        ? OptionalDouble.of(best)
        : OptionalDouble.empty();
  }

  static double bestAliasScore(String caption, AttributeValue attribute, AliasTable aliases) {
    double best = 0.0;
    for (String alias : aliases.aliasesFor(attribute.key())) {
      best = Math.max(best, TextSimilarity.phraseScore(caption, alias));
    }
    return best;
  }
}
