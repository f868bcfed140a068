package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.exception.UnknownAttributeException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable per-attribute alias table: the names and captions a form may use for each profile
 * attribute, plus domain tokens that identify compatible options of choice fields.
 *
 * <p>Callers extend the built-in table with {@link #withAdditional(Map)}; aliases are only ever
 * added, never replaced.
 */
public final class AliasTable {

  private static final Map<AttributeKey, List<String>> DEFAULT_DOMAIN_TOKENS =
      Map.of(
          AttributeKey.EDUCATION_DEGREE,
          List.of(
              "bachelor", "master", "phd", "doctor", "doctorate", "associate", "diploma", "mba",
              "bsc", "msc", "ba", "bs", "ma", "ms", "high school", "ged"));

  private final Map<AttributeKey, List<String>> aliases;
  private final Map<AttributeKey, List<String>> domainTokens;

  private AliasTable(
      Map<AttributeKey, List<String>> aliases, Map<AttributeKey, List<String>> domainTokens) {
    this.aliases = Collections.unmodifiableMap(aliases);
    this.domainTokens = Collections.unmodifiableMap(domainTokens);
  }

  /** Returns the built-in alias table. */
  public static AliasTable defaults() {
    Map<AttributeKey, List<String>> aliases = new EnumMap<>(AttributeKey.class);
    Map<AttributeKey, List<String>> domainTokens = new EnumMap<>(AttributeKey.class);
    for (AttributeKey key : AttributeKey.values()) {
      aliases.put(key, key.defaultAliases());
      domainTokens.put(key, DEFAULT_DOMAIN_TOKENS.getOrDefault(key, List.of()));
    }
    return new AliasTable(aliases, domainTokens);
  }

  /**
   * Returns a copy with extra aliases appended.
   *
   * @param extra aliases per external attribute key
   * @return the extended table
   * @throws UnknownAttributeException if a key is not a known attribute key
   */
  public AliasTable withAdditional(Map<String, List<String>> extra) {
    return new AliasTable(merge(aliases, extra), domainTokens);
  }

  /**
   * Returns a copy with extra domain tokens appended.
   *
   * @param extra domain tokens per external attribute key
   * @return the extended table
   * @throws UnknownAttributeException if a key is not a known attribute key
   */
  public AliasTable withDomainTokens(Map<String, List<String>> extra) {
    return new AliasTable(aliases, merge(domainTokens, extra));
  }

  public List<String> aliasesFor(AttributeKey key) {
    return aliases.getOrDefault(key, List.of());
  }

  public List<String> domainTokensFor(AttributeKey key) {
    return domainTokens.getOrDefault(key, List.of());
  }

  /** Returns the aliases keyed by external attribute key, in declaration order. */
  public Map<String, List<String>> asMap() {
    Map<String, List<String>> view = new LinkedHashMap<>();
    aliases.forEach((key, values) -> view.put(key.key(), values));
    return Collections.unmodifiableMap(view);
  }

  private static Map<AttributeKey, List<String>> merge(
      Map<AttributeKey, List<String>> base, Map<String, List<String>> extra) {
    Map<AttributeKey, List<String>> merged = new EnumMap<>(base);
    if (extra == null) {
      return merged;
    }
    extra.forEach(
        (name, additions) -> {
          AttributeKey key =
              AttributeKey.fromKey(name).orElseThrow(() -> new UnknownAttributeException(name));
          Set<String> combined = new LinkedHashSet<>(merged.getOrDefault(key, List.of()));
          if (additions != null) {
            additions.stream()
                .filter(alias -> alias != null && !alias.isBlank())
                .map(String::trim)
                .forEach(combined::add);
          }
          merged.put(key, List.copyOf(combined));
        });
    return merged;
  }
}
