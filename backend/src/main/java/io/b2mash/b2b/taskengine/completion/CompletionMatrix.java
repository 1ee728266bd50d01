package io.b2mash.b2b.taskengine.completion;

import io.b2mash.b2b.taskengine.assignment.AssignmentMapper;
import io.b2mash.b2b.taskengine.assignment.Viewer;
import io.b2mash.b2b.taskengine.completion.event.CompletionRecordedEvent;
import io.b2mash.b2b.taskengine.exception.InapplicablePeriodException;
import io.b2mash.b2b.taskengine.fiscal.FiscalPeriodIndexer;
import io.b2mash.b2b.taskengine.recurringtask.RecurringTask;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Completion state of a recurring task over (client x fiscal period). Writes are validated against
 * the task's applicable periods and the actor's visible clients; reads classify each cell as
 * completed, incomplete or not yet due.
 */
@Service
public class CompletionMatrix {

  private static final Logger log = LoggerFactory.getLogger(CompletionMatrix.class);

  private final CompletionStore completionStore;
  private final FiscalPeriodIndexer periodIndexer;
  private final AssignmentMapper assignmentMapper;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public CompletionMatrix(
      CompletionStore completionStore,
      FiscalPeriodIndexer periodIndexer,
      AssignmentMapper assignmentMapper,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.completionStore = completionStore;
    this.periodIndexer = periodIndexer;
    this.assignmentMapper = assignmentMapper;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Marks or unmarks one (client, period) cell.
   *
   * <p>Checks run in order: the period must be applicable to the task's pattern, the client must be
   * visible to the actor, and an ARN task needs a valid ARN to be marked complete. Repeating an
   * identical call leaves the stored record unchanged.
   *
   * @throws InapplicablePeriodException if the period is malformed or not applicable
   * @throws io.b2mash.b2b.taskengine.exception.UnauthorizedClientException if the actor cannot see
   *     the client
   */
  public CompletionRecord setCompletion(
      RecurringTask task,
      String clientId,
      String periodKey,
      boolean completed,
      Viewer actor,
      ArnDetails arn) {
    ArnDetails validatedArn = validateWrite(task, clientId, periodKey, completed, actor, arn);
    String key = periodIndexer.periodKey(periodIndexer.parsePeriodKey(periodKey));
    Instant now = Instant.now(clock);

    Optional<CompletionRecord> existing = completionStore.get(task.getId(), clientId, key);
    CompletionRecord record =
        existing.orElseGet(() -> new CompletionRecord(task.getId(), clientId, key, now));

    boolean changed =
        completed
            ? record.markCompleted(actor.actorId(), now, validatedArn)
            : record.markIncomplete(now);
    if (!changed && existing.isPresent()) {
      log.debug(
          "Completion for task {} client {} period {} unchanged", task.getId(), clientId, key);
      return record;
    }

    record = completionStore.put(record);
    log.info(
        "Recorded completion task={} client={} period={} completed={} actor={}",
        task.getId(),
        clientId,
        key,
        completed,
        actor.actorId());

    eventPublisher.publishEvent(
        new CompletionRecordedEvent(
            task.getId(), task.getTitle(), clientId, key, completed, actor.actorId(), now));
    return record;
  }

  /**
   * Applies several cell writes. Every entry is validated before the first write, so an invalid
   * entry leaves the matrix untouched.
   */
  public List<CompletionRecord> bulkSetCompletion(
      RecurringTask task, List<CompletionEntry> entries, Viewer actor) {
    for (CompletionEntry entry : entries) {
      validateWrite(
          task, entry.clientId(), entry.periodKey(), entry.completed(), actor, entry.arn());
    }
    var records = new ArrayList<CompletionRecord>(entries.size());
    for (CompletionEntry entry : entries) {
      records.add(
          setCompletion(
              task, entry.clientId(), entry.periodKey(), entry.completed(), actor, entry.arn()));
    }
    return records;
  }

  /**
   * Status of one cell. A future period is always {@link CompletionStatus#NOT_YET_DUE}, even if a
   * record exists for it.
   */
  public CompletionStatus getCompletionStatus(
      RecurringTask task, String clientId, String periodKey) {
    String key = requireApplicable(task, periodKey);
    return classify(key, completionStore.get(task.getId(), clientId, key).orElse(null));
  }

  /** Direct lookup by key; past-period records stay retrievable here. */
  public Optional<CompletionRecord> findRecord(
      RecurringTask task, String clientId, String periodKey) {
    String key = periodIndexer.periodKey(periodIndexer.parsePeriodKey(periodKey));
    return completionStore.get(task.getId(), clientId, key);
  }

  public CompletionSummary completionSummary(RecurringTask task, Viewer viewer) {
    return completionSummary(task, viewer, periodIndexer.currentFiscalYear());
  }

  /**
   * Completed cells over expected cells for the viewer's clients in one fiscal year. Only periods
   * up to the current month count, on both sides of the ratio.
   */
  public CompletionSummary completionSummary(RecurringTask task, Viewer viewer, int fiscalYear) {
    Set<String> clients = assignmentMapper.visibleClientIds(task, viewer);
    Set<String> elapsed =
        new HashSet<>(
            periodIndexer.elapsedApplicablePeriods(task.getRecurrencePattern(), fiscalYear));

    long completedCount =
        completionStore.query(task.getId()).stream()
            .filter(CompletionRecord::isCompleted)
            .filter(r -> clients.contains(r.getClientId()))
            .filter(r -> elapsed.contains(r.getPeriodKey()))
            .count();
    return CompletionSummary.of(completedCount, (long) clients.size() * elapsed.size());
  }

  /** Status of every visible client for every applicable period of the fiscal year. */
  public CompletionGrid completionGrid(RecurringTask task, Viewer viewer, int fiscalYear) {
    List<String> periods =
        periodIndexer.applicablePeriods(task.getRecurrencePattern(), fiscalYear);
    Set<String> elapsed =
        new HashSet<>(
            periodIndexer.elapsedApplicablePeriods(task.getRecurrencePattern(), fiscalYear));
    List<String> clients =
        assignmentMapper.visibleClientIds(task, viewer).stream().sorted().toList();

    Map<String, CompletionRecord> recordsByCell =
        completionStore.query(task.getId()).stream()
            .collect(
                Collectors.toMap(
                    r -> cell(r.getClientId(), r.getPeriodKey()), Function.identity()));

    var rows = new ArrayList<CompletionGrid.ClientRow>(clients.size());
    long totalCompleted = 0;
    for (String clientId : clients) {
      var statuses = new LinkedHashMap<String, CompletionStatus>();
      long completedForClient = 0;
      for (String period : periods) {
        CompletionStatus status = classify(period, recordsByCell.get(cell(clientId, period)));
        statuses.put(period, status);
        if (status == CompletionStatus.COMPLETED && elapsed.contains(period)) {
          completedForClient++;
        }
      }
      totalCompleted += completedForClient;
      rows.add(
          new CompletionGrid.ClientRow(
              clientId, statuses, CompletionSummary.of(completedForClient, elapsed.size())));
    }
    return new CompletionGrid(
        fiscalYear,
        periods,
        rows,
        CompletionSummary.of(totalCompleted, (long) clients.size() * elapsed.size()));
  }

  private ArnDetails validateWrite(
      RecurringTask task,
      String clientId,
      String periodKey,
      boolean completed,
      Viewer actor,
      ArnDetails arn) {
    requireApplicable(task, periodKey);
    assignmentMapper.requireVisibleClient(task, actor, clientId);
    if (completed && task.isRequiresArn()) {
      return ArnDetails.requireValid(arn);
    }
    return null;
  }

  private String requireApplicable(RecurringTask task, String periodKey) {
    if (!periodIndexer.isApplicable(task.getRecurrencePattern(), periodKey)) {
      throw new InapplicablePeriodException(periodKey, task.getRecurrencePattern().value());
    }
    return periodIndexer.periodKey(periodIndexer.parsePeriodKey(periodKey));
  }

  private CompletionStatus classify(String periodKey, CompletionRecord record) {
    if (periodIndexer.isFuture(periodKey)) {
      return CompletionStatus.NOT_YET_DUE;
    }
    return record != null && record.isCompleted()
        ? CompletionStatus.COMPLETED
        : CompletionStatus.INCOMPLETE;
  }

  private static String cell(String clientId, String periodKey) {
    return clientId + "|" + periodKey;
  }
}
