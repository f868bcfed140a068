package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldOption;
import com.flamingo.ai.formfill.domain.profile.Profile;
import com.flamingo.ai.formfill.exception.IncoercibleValueException;
import com.flamingo.ai.formfill.service.coerce.ValueCoercer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Assigns profile attributes to extracted fields.
 *
 * <p>Every (attribute, field) pair is scored by the first {@link MatchStrategy} with an opinion,
 * then vetoed when the field kind cannot hold the attribute's semantic type. Choice fields also
 * need a name or label match and at least one option compatible with the attribute. Accepted
 * candidates are assigned greedily by score, then document order, then attribute declaration
 * order, so the same inputs always give the same plan. A profile fact goes into at most one
 * field: the full name and its first/last parts are exclusive, so a form gets either the whole
 * name or the split pair.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FieldMatcher {

  private static final Comparator<MatchCandidate> RANKING =
      Comparator.comparingDouble(MatchCandidate::score)
          .reversed()
          .thenComparingInt(c -> c.field().documentOrder())
          .thenComparingInt(c -> c.attribute().key().ordinal());

  private final List<MatchStrategy> strategies;
  private final ValueCoercer valueCoercer;
  private final FormFillConfig config;

  /**
   * Builds the fill plan.
   *
   * @param profile a validated profile
   * @param fields extracted fields in document order
   * @param aliases the effective alias table
   * @return one entry per field plus the unassigned attribute paths
   */
  public FillPlan match(Profile profile, List<FieldDescriptor> fields, AliasTable aliases) {
    List<AttributeValue> attributes = ProfileAttributes.flatten(profile);

    List<MatchCandidate> candidates = new ArrayList<>();
    for (AttributeValue attribute : attributes) {
      for (FieldDescriptor field : fields) {
        MatchCandidate candidate = evaluate(attribute, field, aliases);
        if (candidate != null) {
          candidates.add(candidate);
        }
      }
    }
    candidates.sort(RANKING);

    Set<AttributeKey> usedAttributes = EnumSet.noneOf(AttributeKey.class);
    Map<String, FillPlanEntry> entriesByField = new HashMap<>();
    for (MatchCandidate candidate : candidates) {
      AttributeKey key = candidate.attribute().key();
      if (usedAttributes.contains(key)
          || key.conflictsWith(usedAttributes)
          || entriesByField.containsKey(candidate.fieldDescriptorId())) {
        continue;
      }
      usedAttributes.add(key);
      entriesByField.put(candidate.fieldDescriptorId(), toEntry(candidate));
    }

    List<FillPlanEntry> entries = new ArrayList<>();
    for (FieldDescriptor field : fields) {
      entries.add(entriesByField.getOrDefault(field.id(), FillPlanEntry.unmatched(field)));
    }

    // Split keys are reported through their source: the full name is covered when either
    // the full name or one of its parts went into a field.
    Set<String> unassigned = new LinkedHashSet<>();
    for (AttributeValue attribute : attributes) {
      AttributeKey key = attribute.key();
      if (key.source() == null
          && !usedAttributes.contains(key)
          && !key.conflictsWith(usedAttributes)) {
        unassigned.add(attribute.path());
      }
    }

    FillPlan plan = new FillPlan(entries, new ArrayList<>(unassigned));
    log.info(
        "Fill plan: fields={}, assigned={}, unmatched={}, unassignedAttributes={}",
        fields.size(),
        entriesByField.size(),
        plan.unmatchedFieldIds().size(),
        unassigned.size());
    return plan;
  }

  private MatchCandidate evaluate(
      AttributeValue attribute, FieldDescriptor field, AliasTable aliases) {
    String strategyName = null;
    double score = 0.0;
    for (MatchStrategy strategy : strategies) {
      OptionalDouble opinion = strategy.score(attribute, field, aliases);
      if (opinion.isPresent()) {
        strategyName = strategy.name();
        score = opinion.getAsDouble();
        break;
      }
    }
    if (strategyName == null) {
      return null;
    }

    if (!attribute.semanticType().isCompatibleWith(field.kind())) {
      log.debug(
          "Veto {} -> {}: {} cannot hold {}",
          attribute.path(),
          field.id(),
          field.kind(),
          attribute.semanticType());
      return null;
    }
    if (field.kind().isChoice()
        && (PlaceholderStrategy.NAME.equals(strategyName)
            || !hasCompatibleOption(attribute, field, aliases))) {
      log.debug("Choice field {} has no option compatible with {}", field.id(), attribute.path());
      return null;
    }
    if (score < config.getMatching().floorFor(field.kind())) {
      return null;
    }

    log.debug(
        "Candidate {} -> {} score={} via {}", attribute.path(), field.id(), score, strategyName);
    return new MatchCandidate(attribute, field, score, strategyName);
  }

  private boolean hasCompatibleOption(
      AttributeValue attribute, FieldDescriptor field, AliasTable aliases) {
    List<String> domainTokens = aliases.domainTokensFor(attribute.key());
    double floor = config.getMatching().getOptionFloor();
    for (FieldOption option : field.options()) {
      for (String token : domainTokens) {
        if (TextSimilarity.containsPhrase(option.displayText(), token)
            || TextSimilarity.containsPhrase(option.value(), token)) {
          return true;
        }
      }
      for (String item : attribute.items()) {
        if (TextSimilarity.optionScore(item, option.displayText()) >= floor
            || TextSimilarity.optionScore(item, option.value()) >= floor) {
          return true;
        }
      }
    }
    return false;
  }

  /** A value that cannot be coerced keeps its field; the field is not offered to others. */
  private FillPlanEntry toEntry(MatchCandidate candidate) {
    try {
      CoercedValue value = valueCoercer.coerce(candidate.attribute(), candidate.field());
      return FillPlanEntry.assigned(candidate, value);
    } catch (IncoercibleValueException e) {
      log.warn(
          "Cannot coerce {} for field {}: {}",
          candidate.profileAttributePath(),
          candidate.fieldDescriptorId(),
          e.getMessage());
      return FillPlanEntry.incoercible(candidate, e);
    }
  }
}
