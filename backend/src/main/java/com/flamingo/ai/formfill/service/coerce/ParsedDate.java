package com.flamingo.ai.formfill.service.coerce;

import java.time.LocalDate;

/**
 * A source date with the precision it was written in. Missing month and day are filled with
 * January and 1.
 */
record ParsedDate(LocalDate date, Precision precision) {

  enum Precision {
    YEAR,
    MONTH,
    DAY
  }
}
