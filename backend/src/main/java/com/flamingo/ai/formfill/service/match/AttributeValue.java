package com.flamingo.ai.formfill.service.match;

import java.util.List;

/**
 * One bindable profile value.
 *
 * @param key the attribute key
 * @param path source path in the profile, for example {@code education[0].degree}
 * @param text the value as one text
 * @param items the individual values for list attributes, otherwise the text alone
 */
public record AttributeValue(AttributeKey key, String path, String text, List<String> items) {

  public AttributeValue {
    items = items == null ? List.of(text) : List.copyOf(items);
  }

  public static AttributeValue of(AttributeKey key, String path, String text) {
    return new AttributeValue(key, path, text, List.of(text));
  }

  public SemanticType semanticType() {
    return key.semanticType();
  }
}
