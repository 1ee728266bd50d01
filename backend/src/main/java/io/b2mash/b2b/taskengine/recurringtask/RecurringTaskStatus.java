package io.b2mash.b2b.taskengine.recurringtask;

/**
 * Lifecycle of a recurring task. {@code PAUSED} doubles as the soft-delete state for tasks that
 * already have completion history.
 */
public enum RecurringTaskStatus {
  ACTIVE,
  PAUSED,
  COMPLETED
}
