package io.b2mash.b2b.taskengine.completion;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class CompletionRecordTest {

  private static final Instant T0 = Instant.parse("2026-04-15T04:30:00Z");
  private static final Instant T1 = Instant.parse("2026-04-16T04:30:00Z");

  @Test
  void markCompleted_sameActorTwice_keepsFirstTimestamp() {
    var record = new CompletionRecord(UUID.randomUUID(), "C1", "2026-04", T0);

    assertThat(record.markCompleted("E1", T0, null)).isTrue();
    assertThat(record.markCompleted("E1", T1, null)).isFalse();
    assertThat(record.getCompletedAt()).isEqualTo(T0);
  }

  @Test
  void markCompleted_differentActor_overwrites() {
    var record = new CompletionRecord(UUID.randomUUID(), "C1", "2026-04", T0);
    record.markCompleted("E1", T0, null);

    assertThat(record.markCompleted("mgr-1", T1, null)).isTrue();
    assertThat(record.getCompletedBy()).isEqualTo("mgr-1");
    assertThat(record.getCompletedAt()).isEqualTo(T1);
  }

  @Test
  void markIncomplete_clearsCompletionFields() {
    var record = new CompletionRecord(UUID.randomUUID(), "C1", "2026-04", T0);
    record.markCompleted("E1", T0, new ArnDetails("123456789012345", "Asha"));

    assertThat(record.markIncomplete(T1)).isTrue();
    assertThat(record.isCompleted()).isFalse();
    assertThat(record.getCompletedBy()).isNull();
    assertThat(record.getCompletedAt()).isNull();
    assertThat(record.getArnNumber()).isNull();
    assertThat(record.getArnName()).isNull();
    assertThat(record.getUpdatedAt()).isEqualTo(T1);
  }

  @Test
  void markIncomplete_neverCompleted_isNoOp() {
    var record = new CompletionRecord(UUID.randomUUID(), "C1", "2026-04", T0);

    assertThat(record.markIncomplete(T1)).isFalse();
    assertThat(record.getUpdatedAt()).isEqualTo(T0);
  }
}
