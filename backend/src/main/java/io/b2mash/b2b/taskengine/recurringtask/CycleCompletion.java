package io.b2mash.b2b.taskengine.recurringtask;

import java.time.Instant;
import java.time.LocalDate;

/** One closed cycle of a recurring task. Stored in the task's JSON cycle history. */
public record CycleCompletion(LocalDate occurrence, String completedBy, Instant completedAt) {}
