package io.b2mash.b2b.taskengine.fiscal;

import io.b2mash.b2b.taskengine.config.FiscalCalendarConfig.FiscalCalendarProperties;
import io.b2mash.b2b.taskengine.exception.InapplicablePeriodException;
import io.b2mash.b2b.taskengine.recurrence.RecurrencePattern;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps dates onto {@code YYYY-MM} period keys and decides which months of a fiscal year carry a
 * completion for a given recurrence pattern.
 *
 * <p>A fiscal year is named by the calendar year in which it starts: with the default April start,
 * fiscal year 2026 runs 2026-04 through 2027-03.
 */
@Component
public class FiscalPeriodIndexer {

  private static final DateTimeFormatter PERIOD_KEY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM");
  private static final Pattern PERIOD_KEY_SHAPE = Pattern.compile("\\d{4}-\\d{2}");
  private static final int MONTHS_PER_YEAR = 12;

  private final Clock clock;
  private final FiscalCalendarProperties properties;

  public FiscalPeriodIndexer(Clock clock, FiscalCalendarProperties properties) {
    this.clock = clock;
    this.properties = properties;
  }

  public String periodKey(LocalDate date) {
    return periodKey(YearMonth.from(date));
  }

  public String periodKey(YearMonth month) {
    return month.format(PERIOD_KEY_FORMAT);
  }

  /**
   * Parses a {@code YYYY-MM} key.
   *
   * @throws InapplicablePeriodException if the key is malformed
   */
  public YearMonth parsePeriodKey(String periodKey) {
    if (periodKey == null || !PERIOD_KEY_SHAPE.matcher(periodKey).matches()) {
      throw InapplicablePeriodException.malformed(periodKey);
    }
    try {
      return YearMonth.parse(periodKey, PERIOD_KEY_FORMAT);
    } catch (DateTimeParseException e) {
      throw InapplicablePeriodException.malformed(periodKey);
    }
  }

  public int fiscalYearOf(YearMonth month) {
    return month.getMonthValue() >= properties.firstMonth() ? month.getYear() : month.getYear() - 1;
  }

  public int fiscalYearOf(LocalDate date) {
    return fiscalYearOf(YearMonth.from(date));
  }

  public int fiscalYearOf(String periodKey) {
    return fiscalYearOf(parsePeriodKey(periodKey));
  }

  /** The twelve period keys of a fiscal year, first month first. */
  public List<String> fiscalYearMonths(int fiscalYear) {
    YearMonth first = YearMonth.of(fiscalYear, properties.firstMonth());
    var keys = new ArrayList<String>(MONTHS_PER_YEAR);
    for (int i = 0; i < MONTHS_PER_YEAR; i++) {
      keys.add(periodKey(first.plusMonths(i)));
    }
    return List.copyOf(keys);
  }

  /**
   * Period keys of the fiscal year that carry a completion under {@code pattern}: every month for
   * monthly, every third month for quarterly, months 0 and 6 for half-yearly and the first month
   * for yearly. Day-based patterns are not period-addressable and yield an empty list.
   */
  public List<String> applicablePeriods(RecurrencePattern pattern, int fiscalYear) {
    if (!pattern.isPeriodAddressable()) {
      return List.of();
    }
    List<String> months = fiscalYearMonths(fiscalYear);
    var applicable = new ArrayList<String>();
    for (int i = 0; i < MONTHS_PER_YEAR; i += pattern.monthsPerStep()) {
      applicable.add(months.get(i));
    }
    return List.copyOf(applicable);
  }

  /**
   * True when {@code periodKey} is one of the applicable periods of its own fiscal year.
   *
   * @throws InapplicablePeriodException if the key is malformed
   */
  public boolean isApplicable(RecurrencePattern pattern, String periodKey) {
    YearMonth month = parsePeriodKey(periodKey);
    return applicablePeriods(pattern, fiscalYearOf(month)).contains(periodKey(month));
  }

  public YearMonth currentMonth() {
    return YearMonth.now(clock);
  }

  public String currentPeriod() {
    return periodKey(currentMonth());
  }

  public int currentFiscalYear() {
    return fiscalYearOf(currentMonth());
  }

  /** True when the period starts after the current month. */
  public boolean isFuture(String periodKey) {
    return parsePeriodKey(periodKey).isAfter(currentMonth());
  }

  /** Applicable periods of {@code fiscalYear} up to and including the current month. */
  public List<String> elapsedApplicablePeriods(RecurrencePattern pattern, int fiscalYear) {
    YearMonth current = currentMonth();
    return applicablePeriods(pattern, fiscalYear).stream()
        .filter(key -> !parsePeriodKey(key).isAfter(current))
        .toList();
  }

  /**
   * Applicable periods offered for new entries: from the current month forward over the configured
   * horizon. Past periods are left out here but remain addressable by key.
   */
  public List<String> displayPeriods(RecurrencePattern pattern) {
    YearMonth from = currentMonth();
    YearMonth until = from.plusYears(properties.displayHorizonYears());
    var periods = new ArrayList<String>();
    for (int year = fiscalYearOf(from); year <= fiscalYearOf(until); year++) {
      for (String key : applicablePeriods(pattern, year)) {
        YearMonth month = parsePeriodKey(key);
        if (!month.isBefore(from) && month.isBefore(until)) {
          periods.add(key);
        }
      }
    }
    return List.copyOf(periods);
  }
}
