package io.b2mash.b2b.taskengine.recurringtask.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a cycle of a recurring task is closed. {@code nextOccurrence} is null when the
 * schedule has run past its end date.
 */
public record TaskCycleCompletedEvent(
    UUID recurringTaskId,
    String taskTitle,
    LocalDate completedOccurrence,
    LocalDate nextOccurrence,
    String actorId,
    Instant occurredAt) {}
