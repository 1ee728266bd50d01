package io.b2mash.b2b.taskengine.recurrence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.taskengine.exception.InvalidPatternException;
import org.junit.jupiter.api.Test;

class RecurrencePatternTest {

  @Test
  void fromValue_wireValue_parses() {
    assertThat(RecurrencePattern.fromValue("half-yearly")).isEqualTo(RecurrencePattern.HALF_YEARLY);
    assertThat(RecurrencePattern.fromValue("quarterly")).isEqualTo(RecurrencePattern.QUARTERLY);
  }

  @Test
  void fromValue_constantNameOrMixedCase_parses() {
    assertThat(RecurrencePattern.fromValue("HALF_YEARLY")).isEqualTo(RecurrencePattern.HALF_YEARLY);
    assertThat(RecurrencePattern.fromValue("Monthly")).isEqualTo(RecurrencePattern.MONTHLY);
  }

  @Test
  void fromValue_unknown_throwsInvalidPattern() {
    assertThatThrownBy(() -> RecurrencePattern.fromValue("hourly"))
        .isInstanceOfSatisfying(
            InvalidPatternException.class,
            e -> {
              assertThat(e.getStatusCode().value()).isEqualTo(400);
              assertThat(e.getBody().getProperties()).containsEntry("pattern", "hourly");
            });
  }

  @Test
  void fromValue_null_throwsInvalidPattern() {
    assertThatThrownBy(() -> RecurrencePattern.fromValue(null))
        .isInstanceOf(InvalidPatternException.class);
  }

  @Test
  void description_isHumanReadable() {
    assertThat(RecurrencePattern.DAILY.description()).isEqualTo("Every day");
    assertThat(RecurrencePattern.QUARTERLY.description()).isEqualTo("Every 3 months");
    assertThat(RecurrencePattern.YEARLY.description()).isEqualTo("Every year");
  }

  @Test
  void isPeriodAddressable_onlyMonthBasedPatterns() {
    assertThat(RecurrencePattern.DAILY.isPeriodAddressable()).isFalse();
    assertThat(RecurrencePattern.WEEKLY.isPeriodAddressable()).isFalse();
    assertThat(RecurrencePattern.MONTHLY.isPeriodAddressable()).isTrue();
    assertThat(RecurrencePattern.HALF_YEARLY.monthsPerStep()).isEqualTo(6);
  }
}
