package com.flamingo.ai.formfill.service.fill;

import java.util.List;
import java.util.Map;

/**
 * Per-run options.
 *
 * @param extraAliases aliases added to the configured table for this run only, keyed by attribute
 *     key
 */
public record FillOptions(Map<String, List<String>> extraAliases) {

  public FillOptions {
    extraAliases = extraAliases == null ? Map.of() : Map.copyOf(extraAliases);
  }

  public static FillOptions defaults() {
    return new FillOptions(Map.of());
  }
}
