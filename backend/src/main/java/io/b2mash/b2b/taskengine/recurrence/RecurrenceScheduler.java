package io.b2mash.b2b.taskengine.recurrence;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Occurrence arithmetic for recurring tasks. Stateless: every method is a pure function of its
 * arguments.
 *
 * <p>Month-based steps clamp to the last day of a shorter target month (Jan 31 + 1 month = Feb 28
 * or 29) and never roll over into the following month. Schedules are always computed from their
 * anchor ({@code anchor + k steps}), so a clamped date does not shift later occurrences: a Jan 31
 * monthly schedule runs Feb 28, Mar 31, Apr 30, ...
 */
@Component
public class RecurrenceScheduler {

  /** Adds one step of the pattern to {@code fromDate}. */
  public LocalDate nextOccurrence(RecurrencePattern pattern, LocalDate fromDate) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(fromDate, "fromDate");
    return occurrenceAt(pattern, fromDate, 1);
  }

  /**
   * Returns the first occurrence strictly after {@code fromDate} on the schedule anchored at {@code
   * anchorDate}. When {@code fromDate} precedes the anchor, the anchor itself is returned.
   */
  public LocalDate nextOccurrence(
      RecurrencePattern pattern, LocalDate anchorDate, LocalDate fromDate) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(anchorDate, "anchorDate");
    Objects.requireNonNull(fromDate, "fromDate");
    if (fromDate.isBefore(anchorDate)) {
      return anchorDate;
    }
    return occurrenceAt(pattern, anchorDate, stepsUpTo(pattern, anchorDate, fromDate) + 1);
  }

  /**
   * All occurrences from {@code startDate} (inclusive, the anchor) to {@code endDate} (inclusive).
   * Empty when {@code startDate} is after {@code endDate}.
   */
  public List<LocalDate> occurrencesInRange(
      RecurrencePattern pattern, LocalDate startDate, LocalDate endDate) {
    Objects.requireNonNull(pattern, "pattern");
    if (startDate.isAfter(endDate)) {
      return List.of();
    }
    var occurrences = new ArrayList<LocalDate>();
    long k = 0;
    LocalDate current = startDate;
    while (!current.isAfter(endDate)) {
      occurrences.add(current);
      k++;
      current = occurrenceAt(pattern, startDate, k);
    }
    return List.copyOf(occurrences);
  }

  /**
   * Occurrences of the schedule anchored at {@code anchorDate} that fall within {@code [from, to]},
   * both inclusive. Generation starts at the first step on or after {@code from}, so the cost
   * depends only on the width of the window.
   */
  public List<LocalDate> occurrencesBetween(
      RecurrencePattern pattern, LocalDate anchorDate, LocalDate from, LocalDate to) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(anchorDate, "anchorDate");
    if (from.isAfter(to) || anchorDate.isAfter(to)) {
      return List.of();
    }
    long k = from.isAfter(anchorDate) ? stepsUpTo(pattern, anchorDate, from.minusDays(1)) + 1 : 0;
    var occurrences = new ArrayList<LocalDate>();
    LocalDate current = occurrenceAt(pattern, anchorDate, k);
    while (!current.isAfter(to)) {
      occurrences.add(current);
      k++;
      current = occurrenceAt(pattern, anchorDate, k);
    }
    return List.copyOf(occurrences);
  }

  /** The first {@code count} occurrences starting at (and including) {@code startDate}. */
  public List<LocalDate> upcomingOccurrences(
      RecurrencePattern pattern, LocalDate startDate, int count) {
    Objects.requireNonNull(pattern, "pattern");
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0, got: " + count);
    }
    var occurrences = new ArrayList<LocalDate>(count);
    for (int k = 0; k < count; k++) {
      occurrences.add(occurrenceAt(pattern, startDate, k));
    }
    return List.copyOf(occurrences);
  }

  /**
   * True iff {@code candidateDate} is reachable from {@code anchorDate} in a whole number of steps.
   * Month-based patterns are checked by walking the clamped schedule forward, since clamping near
   * month end makes day-of-month comparisons unreliable.
   */
  public boolean isOccurrenceDate(
      RecurrencePattern pattern, LocalDate anchorDate, LocalDate candidateDate) {
    Objects.requireNonNull(pattern, "pattern");
    if (candidateDate.isBefore(anchorDate)) {
      return false;
    }
    switch (pattern) {
      case DAILY:
        return true;
      case WEEKLY:
        return ChronoUnit.DAYS.between(anchorDate, candidateDate) % 7 == 0;
      default:
        long k = 0;
        LocalDate current = anchorDate;
        while (current.isBefore(candidateDate)) {
          k++;
          current = occurrenceAt(pattern, anchorDate, k);
        }
        return current.isEqual(candidateDate);
    }
  }

  /**
   * Number of occurrences in {@code [startDate, endDate]}; same as the size of {@link
   * #occurrencesInRange} without building the list.
   */
  public long occurrenceCount(RecurrencePattern pattern, LocalDate startDate, LocalDate endDate) {
    Objects.requireNonNull(pattern, "pattern");
    if (startDate.isAfter(endDate)) {
      return 0;
    }
    return stepsUpTo(pattern, startDate, endDate) + 1;
  }

  /** The k-th occurrence of the schedule anchored at {@code anchor} (k = 0 is the anchor). */
  static LocalDate occurrenceAt(RecurrencePattern pattern, LocalDate anchor, long k) {
    return switch (pattern) {
      case DAILY -> anchor.plusDays(k);
      case WEEKLY -> anchor.plusWeeks(k);
      case MONTHLY, QUARTERLY, HALF_YEARLY, YEARLY ->
          anchor.plusMonths(k * pattern.monthsPerStep());
    };
  }

  /** Largest k such that occurrence k is on or before {@code date}. Requires date >= anchor. */
  private static long stepsUpTo(RecurrencePattern pattern, LocalDate anchor, LocalDate date) {
    return switch (pattern) {
      case DAILY -> ChronoUnit.DAYS.between(anchor, date);
      case WEEKLY -> ChronoUnit.DAYS.between(anchor, date) / 7;
      case MONTHLY, QUARTERLY, HALF_YEARLY, YEARLY -> {
        long months = ChronoUnit.MONTHS.between(YearMonth.from(anchor), YearMonth.from(date));
        long k = months / pattern.monthsPerStep();
        // Same target month as date but a later day (anchor day > date day)
        if (occurrenceAt(pattern, anchor, k).isAfter(date)) {
          k--;
        }
        yield k;
      }
    };
  }
}
