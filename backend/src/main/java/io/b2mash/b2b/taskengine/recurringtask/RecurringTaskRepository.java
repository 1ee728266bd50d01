package io.b2mash.b2b.taskengine.recurringtask;

import io.b2mash.b2b.taskengine.recurrence.RecurrencePattern;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RecurringTaskRepository extends JpaRepository<RecurringTask, UUID> {

  List<RecurringTask> findAllByOrderByNextOccurrenceAsc();

  List<RecurringTask> findByStatusOrderByNextOccurrenceAsc(RecurringTaskStatus status);

  List<RecurringTask> findByRecurrencePatternOrderByNextOccurrenceAsc(RecurrencePattern pattern);

  List<RecurringTask> findByStatusAndRecurrencePatternOrderByNextOccurrenceAsc(
      RecurringTaskStatus status, RecurrencePattern pattern);
}
