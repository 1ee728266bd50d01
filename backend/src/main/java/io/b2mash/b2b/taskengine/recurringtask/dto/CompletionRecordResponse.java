package io.b2mash.b2b.taskengine.recurringtask.dto;

import io.b2mash.b2b.taskengine.completion.CompletionRecord;
import java.time.Instant;
import java.util.UUID;

public record CompletionRecordResponse(
    UUID id,
    UUID recurringTaskId,
    String clientId,
    String periodKey,
    boolean completed,
    String completedBy,
    Instant completedAt,
    String arnNumber,
    String arnName) {

  public static CompletionRecordResponse from(CompletionRecord record) {
    return new CompletionRecordResponse(
        record.getId(),
        record.getRecurringTaskId(),
        record.getClientId(),
        record.getPeriodKey(),
        record.isCompleted(),
        record.getCompletedBy(),
        record.getCompletedAt(),
        record.getArnNumber(),
        record.getArnName());
  }
}
