package io.b2mash.b2b.taskengine.recurringtask;

import io.b2mash.b2b.taskengine.recurrence.RecurrencePattern;

/** Optional list criteria; a null field does not filter. */
public record TaskFilter(RecurringTaskStatus status, RecurrencePattern pattern) {

  public static final TaskFilter ALL = new TaskFilter(null, null);
}
