package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.domain.form.FieldDescriptor;

/** A scored (attribute, field) pair considered during assignment. */
record MatchCandidate(
    AttributeValue attribute, FieldDescriptor field, double score, String strategyName) {

  String profileAttributePath() {
    return attribute.path();
  }

  String fieldDescriptorId() {
    return field.id();
  }
}
