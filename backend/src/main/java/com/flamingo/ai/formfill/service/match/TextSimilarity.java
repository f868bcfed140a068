package com.flamingo.ai.formfill.service.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Text normalization and similarity scoring shared by field matching and option coercion.
 *
 * <p>Normalized text is lower case, camelCase split, apostrophes removed and every other
 * non-alphanumeric run replaced by one space. Scores are in [0, 1].
 */
public final class TextSimilarity {

  /** Tokens that carry no meaning for matching and never count as shared. */
  static final Set<String> STOP_TOKENS =
      Set.of(
          "a", "an", "and", "or", "the", "of", "in", "at", "to", "for", "your", "you", "my",
          "please", "enter", "here", "type", "provide", "what", "is");

  private TextSimilarity() {}

  /**
   * Normalizes raw text.
   *
   * @param raw text, may be null
   * @return normalized text, empty for null
   */
  public static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    String split = raw.replaceAll("([a-z0-9])([A-Z])", "$1 $2");
    return split
        .toLowerCase()
        .replaceAll("['’]", "")
        .replaceAll("[^\\p{L}\\p{N}]+", " ")
        .trim();
  }

  /**
   * Splits raw text into normalized, lightly stemmed tokens.
   *
   * @param raw text, may be null
   * @return tokens in order
   */
  public static List<String> tokens(String raw) {
    String normalized = normalize(raw);
    if (normalized.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(normalized.split(" ")).map(TextSimilarity::stem).toList();
  }

  /** Tokens without stop tokens, deduplicated, in order. */
  static Set<String> significantTokens(String raw) {
    Set<String> significant = new LinkedHashSet<>(tokens(raw));
    significant.removeAll(STOP_TOKENS);
    return significant;
  }

  /** Whether both texts have at least one significant token in common. */
  public static boolean sharesToken(String a, String b) {
    Set<String> left = significantTokens(a);
    return significantTokens(b).stream().anyMatch(left::contains);
  }

  /**
   * Whether the phrase appears in the text on token boundaries.
   *
   * @param text text to search
   * @param phrase phrase of one or more tokens
   * @return true if every phrase token appears contiguously in the text
   */
  public static boolean containsPhrase(String text, String phrase) {
    List<String> needle = tokens(phrase);
    return !needle.isEmpty() && Collections.indexOfSubList(tokens(text), needle) >= 0;
  }

  /** Whether two texts are equal once normalized and with spaces removed. */
  public static boolean compactEquals(String a, String b) {
    String left = normalize(a).replace(" ", "");
    return !left.isEmpty() && left.equals(normalize(b).replace(" ", ""));
  }

  /**
   * Scores how well a caption (label or placeholder) matches one alias. Requires a shared token;
   * otherwise returns 0. Exact matches score 1.0; an alias found on token boundaries inside the
   * caption scores by its share of the caption; otherwise normalized edit distance decides.
   *
   * @param caption label or placeholder text
   * @param alias one alias of a profile attribute
   * @return score in [0, 1]
   */
  public static double phraseScore(String caption, String alias) {
    if (compactEquals(caption, alias)) {
      return 1.0;
    }
    if (!sharesToken(caption, alias)) {
      return 0.0;
    }
    String left = normalize(caption);
    String right = normalize(alias);
    double score = editSimilarity(left, right);
    if (containsPhrase(caption, alias)) {
      score = Math.max(score, 0.5 + 0.5 * right.length() / left.length());
    }
    return score;
  }

  /**
   * Scores how well a profile value matches one option text. Shared significant tokens score by
   * how much of the option they cover; near-identical spellings score by edit distance.
   *
   * @param value the profile value
   * @param optionText the option display text or value
   * @return score in [0, 1]
   */
  public static double optionScore(String value, String optionText) {
    if (compactEquals(value, optionText)) {
      return 1.0;
    }
    String left = normalize(value);
    String right = normalize(optionText);
    if (left.isEmpty() || right.isEmpty()) {
      return 0.0;
    }
    double edit = editSimilarity(left, right);
    Set<String> valueTokens = significantTokens(value);
    Set<String> optionTokens = significantTokens(optionText);
    List<String> shared = new ArrayList<>(optionTokens);
    shared.retainAll(valueTokens);
    if (shared.isEmpty() || optionTokens.isEmpty()) {
      return edit >= 0.8 ? edit : 0.0;
    }
    double coverage = (double) shared.size() / optionTokens.size();
    return Math.max(edit, 0.4 + 0.6 * coverage);
  }

  /** One minus the Levenshtein distance divided by the longer length. */
  public static double editSimilarity(String a, String b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 1.0;
    }
    int distance = levenshteinDistance(a, b);
    return 1.0 - (double) distance / Math.max(a.length(), b.length());
  }

  /** Levenshtein distance in O(min(m, n)) space. */
  static int levenshteinDistance(String a, String b) {
    if (a.length() < b.length()) {
      String swap = a;
      a = b;
      b = swap;
    }
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }

  private static String stem(String token) {
    if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
      return token.substring(0, token.length() - 1);
    }
    return token;
  }
}
