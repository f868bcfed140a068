package com.flamingo.ai.formfill.service.coerce;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class DateValueFormatterTest {

  @ParameterizedTest
  @CsvSource({
    "2019-09-15, 2019-09-15, DAY",
    "9/15/2019, 2019-09-15, DAY",
    "2019-09, 2019-09-01, MONTH",
    "2019/09, 2019-09-01, MONTH",
    "9/2019, 2019-09-01, MONTH",
    "Sep 2019, 2019-09-01, MONTH",
    "Sep. 2019, 2019-09-01, MONTH",
    "september 2019, 2019-09-01, MONTH",
    "2019, 2019-01-01, YEAR"
  })
  void shouldParseResumeDateShapes(String raw, String expected, ParsedDate.Precision precision) {
    assertThat(DateValueFormatter.parse(raw))
        .contains(new ParsedDate(LocalDate.parse(expected), precision));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "someday", "Q3 2019", "19"})
  void shouldRejectUnknownShapes(String raw) {
    assertThat(DateValueFormatter.parse(raw)).isEmpty();
  }

  @Test
  void shouldRecognizeOpenEndedWords() {
    assertThat(DateValueFormatter.isOpenEnded(" Present ")).isTrue();
    assertThat(DateValueFormatter.isOpenEnded("2020")).isFalse();
    assertThat(DateValueFormatter.isOpenEnded(null)).isFalse();
  }

  @Test
  void shouldTurnHintsIntoPatterns() {
    LocalDate date = LocalDate.of(2019, 5, 7);

    assertThat(DateValueFormatter.patternFor(null)).contains(DateValueFormatter.ISO_DATE);
    assertThat(DateValueFormatter.patternFor("datetime-local").get().format(date))
        .isEqualTo("2019-05-07T00:00");
    assertThat(DateValueFormatter.patternFor("DD.MM.YYYY").get().format(date))
        .isEqualTo("07.05.2019");
    assertThat(DateValueFormatter.patternFor("mm/yyyy").get().format(date)).isEqualTo("05/2019");
    assertThat(DateValueFormatter.patternFor("week")).isEmpty();
  }
}
