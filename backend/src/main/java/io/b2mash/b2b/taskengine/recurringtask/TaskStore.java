package io.b2mash.b2b.taskengine.recurringtask;

import java.util.List;
import java.util.UUID;

/** Persistence seam for recurring tasks. */
public interface TaskStore {

  /**
   * @throws io.b2mash.b2b.taskengine.exception.ResourceNotFoundException if no task has the id
   */
  RecurringTask load(UUID taskId);

  RecurringTask save(RecurringTask task);

  /** Tasks matching the filter, ordered by next occurrence. */
  List<RecurringTask> list(TaskFilter filter);

  void delete(RecurringTask task);
}
