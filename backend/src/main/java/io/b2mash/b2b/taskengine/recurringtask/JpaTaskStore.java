package io.b2mash.b2b.taskengine.recurringtask;

import io.b2mash.b2b.taskengine.exception.ResourceNotFoundException;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Repository;

@Repository
public class JpaTaskStore implements TaskStore {

  private final RecurringTaskRepository repository;

  public JpaTaskStore(RecurringTaskRepository repository) {
    this.repository = repository;
  }

  @Override
  public RecurringTask load(UUID taskId) {
    return repository
        .findById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("RecurringTask", taskId));
  }

  @Override
  public RecurringTask save(RecurringTask task) {
    return repository.saveAndFlush(task);
  }

  @Override
  public List<RecurringTask> list(TaskFilter filter) {
    if (filter.status() != null && filter.pattern() != null) {
      return repository.findByStatusAndRecurrencePatternOrderByNextOccurrenceAsc(
          filter.status(), filter.pattern());
    }
    if (filter.status() != null) {
      return repository.findByStatusOrderByNextOccurrenceAsc(filter.status());
    }
    if (filter.pattern() != null) {
      return repository.findByRecurrencePatternOrderByNextOccurrenceAsc(filter.pattern());
    }
    return repository.findAllByOrderByNextOccurrenceAsc();
  }

  @Override
  public void delete(RecurringTask task) {
    repository.delete(task);
  }
}
