package io.b2mash.b2b.taskengine.recurringtask.event;

import java.time.Instant;
import java.util.UUID;

public record TaskPausedEvent(
    UUID recurringTaskId, String taskTitle, String actorId, Instant occurredAt) {}
