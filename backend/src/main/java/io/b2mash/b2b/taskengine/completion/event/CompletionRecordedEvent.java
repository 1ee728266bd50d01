package io.b2mash.b2b.taskengine.completion.event;

import java.time.Instant;
import java.util.UUID;

public record CompletionRecordedEvent(
    UUID recurringTaskId,
    String taskTitle,
    String clientId,
    String periodKey,
    boolean completed,
    String actorId,
    Instant occurredAt) {}
