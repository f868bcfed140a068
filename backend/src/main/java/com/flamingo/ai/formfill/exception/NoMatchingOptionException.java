package com.flamingo.ai.formfill.exception;

/** Exception thrown when no option of a choice field is close enough to the profile value. */
public class NoMatchingOptionException extends IncoercibleValueException {

  private final double bestScore;

  public NoMatchingOptionException(String fieldId, String value, double bestScore) {
    super(
        fieldId,
        String.format(
            "No option of field %s matches '%s' (best score %.2f)", fieldId, value, bestScore));
    this.bestScore = bestScore;
  }

  public double getBestScore() {
    return bestScore;
  }

  @Override
  public String getKind() {
    return "NoMatchingOption";
  }
}
