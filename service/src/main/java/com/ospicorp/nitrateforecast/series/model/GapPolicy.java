package com.ospicorp.nitrateforecast.series.model;

import com.ospicorp.nitrateforecast.error.GapPolicyException;
import java.util.Locale;

/**
 * Thresholds are in grid steps. Runs of at most {@code shortGapMaxSteps} are short, runs of at
 * least {@code longGapMinSteps} are long, anything in between stays unfilled.
 */
public record GapPolicy(
    int shortGapMaxSteps,
    int longGapMinSteps,
    ShortGapFill shortGapFill,
    LongGapFill longGapFill,
    int seasonSteps
) {

  public GapPolicy {
    if (shortGapMaxSteps < 0) {
      throw new GapPolicyException("shortGapMaxSteps must be >= 0, got " + shortGapMaxSteps);
    }
    if (longGapMinSteps < 1) {
      throw new GapPolicyException("longGapMinSteps must be >= 1, got " + longGapMinSteps);
    }
    if (shortGapMaxSteps >= longGapMinSteps) {
      throw new GapPolicyException("shortGapMaxSteps (" + shortGapMaxSteps
          + ") must be below longGapMinSteps (" + longGapMinSteps + ")");
    }
    shortGapFill = shortGapFill == null ? ShortGapFill.FORWARD_FILL : shortGapFill;
    longGapFill = longGapFill == null ? LongGapFill.NONE : longGapFill;
    if (longGapFill == LongGapFill.SEASONAL_NAIVE && seasonSteps <= 0) {
      throw new GapPolicyException("seasonal-naive long gap fill needs a positive season, got "
          + seasonSteps);
    }
  }

  public enum ShortGapFill {
    FORWARD_FILL,
    LINEAR;

    public static ShortGapFill fromCode(String code) {
      return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
  }

  public enum LongGapFill {
    NONE,
    SEASONAL_NAIVE;

    public static LongGapFill fromCode(String code) {
      return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
  }
}
