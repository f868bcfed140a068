package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import java.util.OptionalDouble;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Scores 1.0 when the field's name or DOM id is one of the attribute's aliases. */
@Component
@Order(1)
public class ExactTokenStrategy implements MatchStrategy {

  public static final String NAME = "exactToken";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public OptionalDouble score(AttributeValue attribute, FieldDescriptor field, AliasTable aliases) {
    for (String alias : aliases.aliasesFor(attribute.key())) {
      if (TextSimilarity.compactEquals(field.name(), alias)
          || TextSimilarity.compactEquals(field.domId(), alias)) {
        return OptionalDouble.of(1.0);
      }
    }
    return OptionalDouble.empty();
  }
}
