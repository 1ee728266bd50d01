package io.b2mash.b2b.taskengine.recurringtask;

import io.b2mash.b2b.taskengine.assignment.AssignmentMapper;
import io.b2mash.b2b.taskengine.assignment.TeamMemberMapping;
import io.b2mash.b2b.taskengine.assignment.Viewer;
import io.b2mash.b2b.taskengine.completion.CompletionEntry;
import io.b2mash.b2b.taskengine.completion.CompletionGrid;
import io.b2mash.b2b.taskengine.completion.CompletionMatrix;
import io.b2mash.b2b.taskengine.completion.CompletionRecord;
import io.b2mash.b2b.taskengine.completion.CompletionStore;
import io.b2mash.b2b.taskengine.completion.CompletionSummary;
import io.b2mash.b2b.taskengine.config.ScheduleConfig.ScheduleProperties;
import io.b2mash.b2b.taskengine.exception.InvalidStateException;
import io.b2mash.b2b.taskengine.exception.ResourceConflictException;
import io.b2mash.b2b.taskengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.taskengine.fiscal.FiscalPeriodIndexer;
import io.b2mash.b2b.taskengine.recurrence.RecurrencePattern;
import io.b2mash.b2b.taskengine.recurrence.RecurrenceScheduler;
import io.b2mash.b2b.taskengine.recurringtask.dto.CompletionRecordResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.CompletionStatusResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.CreateRecurringTaskRequest;
import io.b2mash.b2b.taskengine.recurringtask.dto.CycleHistoryResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.MappingRequest;
import io.b2mash.b2b.taskengine.recurringtask.dto.PeriodsResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.UpdateRecurringTaskRequest;
import io.b2mash.b2b.taskengine.recurringtask.event.TaskCycleCompletedEvent;
import io.b2mash.b2b.taskengine.recurringtask.event.TaskPausedEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for recurring task operations. Loads tasks from the {@link TaskStore}, delegates to
 * the scheduling, period, assignment and completion components, and saves the result.
 *
 * <p>Role gates (who may create, edit or delete) are enforced on the controller; this class only
 * applies per-task visibility.
 */
@Service
public class RecurringTaskOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(RecurringTaskOrchestrator.class);

  private final TaskStore taskStore;
  private final CompletionStore completionStore;
  private final RecurrenceScheduler scheduler;
  private final FiscalPeriodIndexer periodIndexer;
  private final AssignmentMapper assignmentMapper;
  private final CompletionMatrix completionMatrix;
  private final ApplicationEventPublisher eventPublisher;
  private final ScheduleProperties scheduleProperties;
  private final Clock clock;

  public RecurringTaskOrchestrator(
      TaskStore taskStore,
      CompletionStore completionStore,
      RecurrenceScheduler scheduler,
      FiscalPeriodIndexer periodIndexer,
      AssignmentMapper assignmentMapper,
      CompletionMatrix completionMatrix,
      ApplicationEventPublisher eventPublisher,
      ScheduleProperties scheduleProperties,
      Clock clock) {
    this.taskStore = taskStore;
    this.completionStore = completionStore;
    this.scheduler = scheduler;
    this.periodIndexer = periodIndexer;
    this.assignmentMapper = assignmentMapper;
    this.completionMatrix = completionMatrix;
    this.eventPublisher = eventPublisher;
    this.scheduleProperties = scheduleProperties;
    this.clock = clock;
  }

  // --- Task lifecycle ---

  @Transactional
  public VisibleTask createTask(CreateRecurringTaskRequest request, Viewer viewer) {
    RecurrencePattern pattern = RecurrencePattern.fromValue(request.recurrencePattern());
    requireValidDateRange(request.startDate(), request.endDate());

    var task =
        new RecurringTask(
            request.title(),
            request.description(),
            request.priority(),
            request.category(),
            pattern,
            request.startDate(),
            request.endDate(),
            request.requiresArn(),
            request.assignedClientIds(),
            viewer.actorId());
    if (request.teamMemberMappings() != null) {
      assignmentMapper.replaceMappings(task, toMappings(request.teamMemberMappings()));
    }

    task = taskStore.save(task);
    log.info(
        "Created recurring task {} pattern={} clients={} by {}",
        task.getId(),
        pattern.value(),
        task.getAssignedClientIds().size(),
        viewer.actorId());
    return visible(task, viewer);
  }

  /**
   * Updates descriptive fields and the assigned client set. Existing mappings must still reference
   * only assigned clients, so shrinking the set below a mapping is rejected.
   */
  @Transactional
  public VisibleTask updateTask(UUID taskId, UpdateRecurringTaskRequest request, Viewer viewer) {
    var task = taskStore.load(taskId);
    requireValidDateRange(task.getStartDate(), request.endDate());
    assignmentMapper.validateAll(request.assignedClientIds(), task.getTeamMemberMappings());

    task.updateDetails(
        request.title(),
        request.description(),
        request.priority(),
        request.category(),
        request.endDate(),
        request.requiresArn(),
        request.assignedClientIds());
    task = taskStore.save(task);
    log.info("Updated recurring task {}", taskId);
    return visible(task, viewer);
  }

  @Transactional
  public void delete(UUID taskId) {
    var task = taskStore.load(taskId);
    if (completionStore.exists(taskId)) {
      throw new ResourceConflictException(
          "Task has completion history",
          "Recurring task "
              + taskId
              + " has recorded completions and cannot be deleted. Pause it instead.");
    }
    taskStore.delete(task);
    log.info("Deleted recurring task {}", taskId);
  }

  @Transactional
  public VisibleTask pause(UUID taskId, Viewer viewer) {
    var task = taskStore.load(taskId);
    task.pause();
    task = taskStore.save(task);
    log.info("Paused recurring task {}", taskId);
    eventPublisher.publishEvent(
        new TaskPausedEvent(task.getId(), task.getTitle(), viewer.actorId(), Instant.now(clock)));
    return visible(task, viewer);
  }

  /**
   * Reactivates a paused task. Due dates missed while paused are skipped: the next occurrence
   * becomes the first scheduled date on or after today. A schedule already past its end date is
   * completed instead.
   */
  @Transactional
  public VisibleTask resume(UUID taskId, Viewer viewer) {
    var task = taskStore.load(taskId);
    LocalDate today = LocalDate.now(clock);
    LocalDate next =
        scheduler.nextOccurrence(
            task.getRecurrencePattern(), task.getStartDate(), today.minusDays(1));
    if (next.isBefore(task.getNextOccurrence())) {
      next = task.getNextOccurrence();
    }

    task.resume(next);
    if (task.isEndedBefore(next)) {
      task.complete();
      log.info("Resumed recurring task {} past its end date; marked completed", taskId);
    } else {
      log.info("Resumed recurring task {} next={}", taskId, next);
    }
    return visible(taskStore.save(task), viewer);
  }

  /**
   * Closes the current cycle and moves the task to the next anchored occurrence. When that
   * occurrence lies after the end date the task becomes completed and keeps its last due date.
   */
  @Transactional
  public VisibleTask completeCycle(UUID taskId, Viewer viewer) {
    var task = loadVisible(taskId, viewer);
    if (task.getStatus() != RecurringTaskStatus.ACTIVE) {
      throw new InvalidStateException(
          "Invalid task status",
          "Only active tasks can complete a cycle; task " + taskId + " is " + task.getStatus());
    }

    LocalDate completed = task.getNextOccurrence();
    task.recordCycle(completed, viewer.actorId(), Instant.now(clock));
    LocalDate next =
        scheduler.nextOccurrence(task.getRecurrencePattern(), task.getStartDate(), completed);
    if (task.isEndedBefore(next)) {
      task.complete();
      next = null;
      log.info("Recurring task {} finished its schedule at {}", taskId, completed);
    } else {
      task.advanceTo(next);
      log.info("Recurring task {} cycle {} completed; next={}", taskId, completed, next);
    }
    task = taskStore.save(task);

    eventPublisher.publishEvent(
        new TaskCycleCompletedEvent(
            task.getId(), task.getTitle(), completed, next, viewer.actorId(), Instant.now(clock)));
    return visible(task, viewer);
  }

  // --- Mappings ---

  @Transactional
  public VisibleTask updateMappings(UUID taskId, List<MappingRequest> mappings, Viewer viewer) {
    var task = taskStore.load(taskId);
    assignmentMapper.replaceMappings(task, toMappings(mappings));
    task = taskStore.save(task);
    log.info("Replaced mappings of recurring task {}: {} entries", taskId, mappings.size());
    return visible(task, viewer);
  }

  @Transactional
  public VisibleTask upsertMapping(
      UUID taskId, String employeeId, MappingRequest request, Viewer viewer) {
    var task = taskStore.load(taskId);
    assignmentMapper.addOrUpdateMapping(
        task, employeeId, request.employeeName(), request.clientIds());
    task = taskStore.save(task);
    log.info("Set mapping of employee {} on recurring task {}", employeeId, taskId);
    return visible(task, viewer);
  }

  @Transactional
  public VisibleTask removeMapping(UUID taskId, String employeeId, Viewer viewer) {
    var task = taskStore.load(taskId);
    if (assignmentMapper.removeMapping(task, employeeId)) {
      task = taskStore.save(task);
      log.info("Removed mapping of employee {} from recurring task {}", employeeId, taskId);
    }
    return visible(task, viewer);
  }

  // --- Reads ---

  @Transactional(readOnly = true)
  public List<VisibleTask> getVisibleTasksForViewer(Viewer viewer, TaskFilter filter) {
    return taskStore.list(filter).stream()
        .filter(task -> assignmentMapper.isTaskVisible(task, viewer))
        .map(task -> visible(task, viewer))
        .toList();
  }

  /** A task the viewer cannot see is reported as missing. */
  @Transactional(readOnly = true)
  public VisibleTask getTask(UUID taskId, Viewer viewer) {
    return visible(loadVisible(taskId, viewer), viewer);
  }

  /**
   * Scheduled dates within {@code [from, to]}, bounded by the task's start and end dates. The
   * window may span at most {@code taskengine.schedule.max-occurrence-window-days}.
   */
  @Transactional(readOnly = true)
  public List<LocalDate> occurrences(UUID taskId, LocalDate from, LocalDate to, Viewer viewer) {
    var task = loadVisible(taskId, viewer);
    if (to.isBefore(from)) {
      throw new InvalidStateException(
          "Invalid date range", "'to' (" + to + ") is before 'from' (" + from + ")");
    }
    long windowDays = ChronoUnit.DAYS.between(from, to);
    if (windowDays > scheduleProperties.maxOccurrenceWindowDays()) {
      throw new InvalidStateException(
          "Date range too wide",
          "Occurrence window of "
              + windowDays
              + " days exceeds the maximum of "
              + scheduleProperties.maxOccurrenceWindowDays());
    }
    LocalDate upper = task.isEndedBefore(to) ? task.getEndDate() : to;
    return scheduler.occurrencesBetween(
        task.getRecurrencePattern(), task.getStartDate(), from, upper);
  }

  /**
   * Closed cycles of the task and the share of due cycles that were closed. A cycle counts as due
   * when its date is on or before today and within the task's end date.
   */
  @Transactional(readOnly = true)
  public CycleHistoryResponse cycleHistory(UUID taskId, Viewer viewer) {
    var task = loadVisible(taskId, viewer);
    LocalDate today = LocalDate.now(clock);
    LocalDate dueUpTo = task.isEndedBefore(today) ? task.getEndDate() : today;
    long due = scheduler.occurrenceCount(task.getRecurrencePattern(), task.getStartDate(), dueUpTo);
    long closed =
        task.getCycleHistory().stream()
            .filter(cycle -> !cycle.occurrence().isAfter(dueUpTo))
            .count();
    return new CycleHistoryResponse(
        task.getId(), task.getCycleHistory(), CompletionSummary.of(closed, due));
  }

  @Transactional(readOnly = true)
  public PeriodsResponse applicablePeriods(UUID taskId, Integer fiscalYear, Viewer viewer) {
    var task = loadVisible(taskId, viewer);
    int year = fiscalYearOrCurrent(fiscalYear);
    return new PeriodsResponse(
        task.getRecurrencePattern().value(),
        year,
        periodIndexer.applicablePeriods(task.getRecurrencePattern(), year));
  }

  /** Applicable periods from the current month over the configured display horizon. */
  @Transactional(readOnly = true)
  public PeriodsResponse displayPeriods(UUID taskId, Viewer viewer) {
    var task = loadVisible(taskId, viewer);
    return new PeriodsResponse(
        task.getRecurrencePattern().value(),
        null,
        periodIndexer.displayPeriods(task.getRecurrencePattern()));
  }

  // --- Completions ---

  @Transactional
  public CompletionRecord recordCompletion(UUID taskId, CompletionEntry entry, Viewer viewer) {
    var task = taskStore.load(taskId);
    return completionMatrix.setCompletion(
        task, entry.clientId(), entry.periodKey(), entry.completed(), viewer, entry.arn());
  }

  /** All entries are validated before any is written; one bad entry rejects the whole batch. */
  @Transactional
  public List<CompletionRecord> bulkRecordCompletions(
      UUID taskId, List<CompletionEntry> entries, Viewer viewer) {
    var task = taskStore.load(taskId);
    var records = completionMatrix.bulkSetCompletion(task, entries, viewer);
    log.info("Bulk recorded {} completions on recurring task {}", records.size(), taskId);
    return records;
  }

  @Transactional(readOnly = true)
  public CompletionStatusResponse getCompletionStatus(
      UUID taskId, String clientId, String periodKey, Viewer viewer) {
    var task = loadVisible(taskId, viewer);
    assignmentMapper.requireVisibleClient(task, viewer, clientId);
    var status = completionMatrix.getCompletionStatus(task, clientId, periodKey);
    var record = completionMatrix.findRecord(task, clientId, periodKey);
    return new CompletionStatusResponse(
        clientId,
        periodIndexer.periodKey(periodIndexer.parsePeriodKey(periodKey)),
        status,
        record.map(CompletionRecordResponse::from).orElse(null));
  }

  @Transactional(readOnly = true)
  public CompletionSummary getCompletionSummary(UUID taskId, Integer fiscalYear, Viewer viewer) {
    var task = loadVisible(taskId, viewer);
    return completionMatrix.completionSummary(task, viewer, fiscalYearOrCurrent(fiscalYear));
  }

  @Transactional(readOnly = true)
  public CompletionGrid getCompletionGrid(UUID taskId, Integer fiscalYear, Viewer viewer) {
    var task = loadVisible(taskId, viewer);
    return completionMatrix.completionGrid(task, viewer, fiscalYearOrCurrent(fiscalYear));
  }

  // --- Helpers ---

  private RecurringTask loadVisible(UUID taskId, Viewer viewer) {
    var task = taskStore.load(taskId);
    if (!assignmentMapper.isTaskVisible(task, viewer)) {
      log.debug("Recurring task {} not visible to {}", taskId, viewer.actorId());
      throw new ResourceNotFoundException("RecurringTask", taskId);
    }
    return task;
  }

  private VisibleTask visible(RecurringTask task, Viewer viewer) {
    return new VisibleTask(task, assignmentMapper.visibleClientIds(task, viewer));
  }

  private int fiscalYearOrCurrent(Integer fiscalYear) {
    return fiscalYear != null ? fiscalYear : periodIndexer.currentFiscalYear();
  }

  private static void requireValidDateRange(LocalDate startDate, LocalDate endDate) {
    if (endDate != null && endDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid date range",
          "End date " + endDate + " is before start date " + startDate);
    }
  }

  private static List<TeamMemberMapping> toMappings(List<MappingRequest> requests) {
    return requests.stream()
        .map(
            request -> {
              if (request.employeeId() == null || request.employeeId().isBlank()) {
                throw new InvalidStateException(
                    "Invalid mapping", "Every mapping needs an employeeId");
              }
              return request.toMapping();
            })
        .toList();
  }
}
