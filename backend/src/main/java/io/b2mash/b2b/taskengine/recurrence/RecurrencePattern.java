package io.b2mash.b2b.taskengine.recurrence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.b2b.taskengine.exception.InvalidPatternException;

/**
 * Repetition cadence of a recurring task. Month-based patterns advance by whole calendar months;
 * daily and weekly patterns advance by days and are not addressable by fiscal month.
 */
public enum RecurrencePattern {
  DAILY("daily", 0, "Every day"),
  WEEKLY("weekly", 0, "Every week"),
  MONTHLY("monthly", 1, "Every month"),
  QUARTERLY("quarterly", 3, "Every 3 months"),
  HALF_YEARLY("half-yearly", 6, "Every 6 months"),
  YEARLY("yearly", 12, "Every year");

  private final String value;
  private final int monthsPerStep;
  private final String description;

  RecurrencePattern(String value, int monthsPerStep, String description) {
    this.value = value;
    this.monthsPerStep = monthsPerStep;
    this.description = description;
  }

  /** Wire value, e.g. {@code half-yearly}. */
  @JsonValue
  public String value() {
    return value;
  }

  /** Calendar months per step; 0 for day-based patterns. */
  public int monthsPerStep() {
    return monthsPerStep;
  }

  public String description() {
    return description;
  }

  /** True when completions for this pattern are tracked per fiscal month. */
  public boolean isPeriodAddressable() {
    return monthsPerStep > 0;
  }

  /**
   * Parses a wire value. Accepts the enum constant name as well ({@code HALF_YEARLY}).
   *
   * @throws InvalidPatternException if the value is null or unknown
   */
  @JsonCreator
  public static RecurrencePattern fromValue(String value) {
    if (value == null) {
      throw new InvalidPatternException(null);
    }
    for (RecurrencePattern pattern : values()) {
      if (pattern.value.equalsIgnoreCase(value) || pattern.name().equalsIgnoreCase(value)) {
        return pattern;
      }
    }
    throw new InvalidPatternException(value);
  }
}
