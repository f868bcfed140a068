package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import java.util.OptionalDouble;

/**
 * One step of the matching cascade. Strategies are injected in {@code @Order} order and the first
 * one with an opinion decides the score of an (attribute, field) pair.
 */
public interface MatchStrategy {

  /** Name recorded on candidates this strategy produced. */
  String name();

  /**
   * Scores one pair.
   *
   * @param attribute the profile value
   * @param field the candidate field
   * @param aliases the effective alias table
   * @return a score in [0, 1], or empty to leave the decision to the next strategy
   */
  OptionalDouble score(AttributeValue attribute, FieldDescriptor field, AliasTable aliases);
}
