package com.flamingo.ai.formfill.service.match;

import java.util.List;

/**
 * Result of matching: exactly one entry per extracted field, in document order, plus the profile
 * paths no field took.
 */
public record FillPlan(List<FillPlanEntry> entries, List<String> unassignedAttributePaths) {

  public FillPlan {
    entries = List.copyOf(entries);
    unassignedAttributePaths = List.copyOf(unassignedAttributePaths);
  }

  /** Entries that carry a value to apply. */
  public List<FillPlanEntry> assignedEntries() {
    return entries.stream().filter(e -> e.status() == FillPlanEntry.Status.ASSIGNED).toList();
  }

  /** Ids of fields no attribute was assigned to. */
  public List<String> unmatchedFieldIds() {
    return entries.stream()
        .filter(FillPlanEntry::isUnmatched)
        .map(FillPlanEntry::fieldDescriptorId)
        .toList();
  }
}
