package com.flamingo.ai.formfill.service.coerce;

import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/** Parses the date shapes found in resumes and renders them in a field's date pattern. */
final class DateValueFormatter {

  static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  static final DateTimeFormatter ISO_MONTH = DateTimeFormatter.ofPattern("yyyy-MM");
  static final DateTimeFormatter ISO_YEAR = DateTimeFormatter.ofPattern("yyyy");
  static final DateTimeFormatter DATETIME_LOCAL = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'00:00");

  private static final Set<String> OPEN_ENDED = Set.of("present", "current", "now", "ongoing");

  private static final Pattern HINT_PATTERN = Pattern.compile("[yYmMdD]+([-/. ][yYmMdD]+){0,2}");

  private static final List<DateTimeFormatter> DAY_SHAPES =
      List.of(DateTimeFormatter.ISO_LOCAL_DATE, formatter("M/d/yyyy"));

  private static final List<DateTimeFormatter> MONTH_SHAPES =
      List.of(
          formatter("yyyy-MM"),
          formatter("yyyy/MM"),
          formatter("M/yyyy"),
          formatter("MMM yyyy"),
          formatter("MMMM yyyy"));

  private static final Pattern YEAR_SHAPE = Pattern.compile("\\d{4}");

  private DateValueFormatter() {}

  /** Whether the value means the period has not ended. */
  static boolean isOpenEnded(String value) {
    return value != null && OPEN_ENDED.contains(value.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Parses a resume date.
   *
   * @param value raw text such as {@code 2019-09}, {@code Sep 2019} or {@code 2019}
   * @return the parsed date, or empty when no accepted shape fits
   */
  static Optional<ParsedDate> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String text = value.trim().replace(".", "").replaceAll("\\s+", " ");
    for (DateTimeFormatter shape : DAY_SHAPES) {
      try {
        return Optional.of(new ParsedDate(LocalDate.parse(text, shape), ParsedDate.Precision.DAY));
      } catch (DateTimeParseException e) {
        // next shape
      }
    }
    for (DateTimeFormatter shape : MONTH_SHAPES) {
      try {
        LocalDate date = YearMonth.parse(text, shape).atDay(1);
        return Optional.of(new ParsedDate(date, ParsedDate.Precision.MONTH));
      } catch (DateTimeParseException e) {
        // next shape
      }
    }
    if (YEAR_SHAPE.matcher(text).matches()) {
      LocalDate date = Year.parse(text).atDay(1);
      return Optional.of(new ParsedDate(date, ParsedDate.Precision.YEAR));
    }
    return Optional.empty();
  }

  /**
   * Resolves the output pattern for a field's date hint.
   *
   * @param hint native input type ({@code date}, {@code month}, {@code datetime-local}) or a mask
   *     such as {@code MM/DD/YYYY}; null for none
   * @return the formatter, or empty when the hint cannot be turned into a pattern
   */
  static Optional<DateTimeFormatter> patternFor(String hint) {
    if (hint == null || hint.isBlank() || "date".equalsIgnoreCase(hint)) {
      return Optional.of(ISO_DATE);
    }
    if ("month".equalsIgnoreCase(hint)) {
      return Optional.of(ISO_MONTH);
    }
    if ("datetime-local".equalsIgnoreCase(hint)) {
      return Optional.of(DATETIME_LOCAL);
    }
    String mask = hint.trim();
    if (!HINT_PATTERN.matcher(mask).matches()) {
      return Optional.empty();
    }
    StringBuilder pattern = new StringBuilder();
    for (char c : mask.toCharArray()) {
      switch (Character.toLowerCase(c)) {
        case 'y' -> pattern.append('y');
        case 'm' -> pattern.append('M');
        case 'd' -> pattern.append('d');
        default -> pattern.append(c);
      }
    }
    return Optional.of(DateTimeFormatter.ofPattern(pattern.toString(), Locale.ENGLISH));
  }

  /** ISO text at the precision the source was written in. */
  static String isoText(ParsedDate parsed) {
    return switch (parsed.precision()) {
      case YEAR -> parsed.date().format(ISO_YEAR);
      case MONTH -> parsed.date().format(ISO_MONTH);
      case DAY -> parsed.date().format(ISO_DATE);
    };
  }

  private static DateTimeFormatter formatter(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH);
  }
}
