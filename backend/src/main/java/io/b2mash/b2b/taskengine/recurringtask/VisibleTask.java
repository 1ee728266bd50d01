package io.b2mash.b2b.taskengine.recurringtask;

import java.util.Set;

/** A task paired with the clients one viewer may act on. */
public record VisibleTask(RecurringTask task, Set<String> visibleClientIds) {}
