package io.b2mash.b2b.taskengine.recurringtask;

import io.b2mash.b2b.taskengine.assignment.TeamMemberMapping;
import io.b2mash.b2b.taskengine.exception.InvalidStateException;
import io.b2mash.b2b.taskengine.recurrence.RecurrencePattern;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "recurring_tasks")
public class RecurringTask {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", length = 1000)
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Column(name = "category", length = 100)
  private String category;

  @Enumerated(EnumType.STRING)
  @Column(name = "recurrence_pattern", nullable = false, length = 20)
  private RecurrencePattern recurrencePattern;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "next_occurrence", nullable = false)
  private LocalDate nextOccurrence;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private RecurringTaskStatus status;

  @Column(name = "requires_arn", nullable = false)
  private boolean requiresArn;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "assigned_client_ids", nullable = false, columnDefinition = "jsonb")
  private Set<String> assignedClientIds = new LinkedHashSet<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "team_member_mappings", nullable = false, columnDefinition = "jsonb")
  private List<TeamMemberMapping> teamMemberMappings = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "cycle_history", nullable = false, columnDefinition = "jsonb")
  private List<CycleCompletion> cycleHistory = new ArrayList<>();

  @Column(name = "created_by", nullable = false)
  private String createdBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RecurringTask() {}

  public RecurringTask(
      String title,
      String description,
      TaskPriority priority,
      String category,
      RecurrencePattern recurrencePattern,
      LocalDate startDate,
      LocalDate endDate,
      boolean requiresArn,
      Collection<String> assignedClientIds,
      String createdBy) {
    this.title = title;
    this.description = description;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.category = category;
    this.recurrencePattern = recurrencePattern;
    this.startDate = startDate;
    this.endDate = endDate;
    this.nextOccurrence = startDate;
    this.status = RecurringTaskStatus.ACTIVE;
    this.requiresArn = requiresArn;
    this.assignedClientIds = new LinkedHashSet<>(assignedClientIds);
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Updates the descriptive fields. Pattern and start date are fixed once created. */
  public void updateDetails(
      String title,
      String description,
      TaskPriority priority,
      String category,
      LocalDate endDate,
      boolean requiresArn,
      Collection<String> assignedClientIds) {
    this.title = title;
    this.description = description;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.category = category;
    this.endDate = endDate;
    this.requiresArn = requiresArn;
    this.assignedClientIds = new LinkedHashSet<>(assignedClientIds);
    this.updatedAt = Instant.now();
  }

  /** Replaces the whole mapping list. Callers validate entries first. */
  public void replaceTeamMemberMappings(List<TeamMemberMapping> mappings) {
    this.teamMemberMappings = new ArrayList<>(mappings);
    this.updatedAt = Instant.now();
  }

  public void pause() {
    requireStatus(RecurringTaskStatus.ACTIVE, "pause");
    this.status = RecurringTaskStatus.PAUSED;
    this.updatedAt = Instant.now();
  }

  /** Reactivates a paused task with the given next due date. */
  public void resume(LocalDate nextOccurrence) {
    requireStatus(RecurringTaskStatus.PAUSED, "resume");
    this.status = RecurringTaskStatus.ACTIVE;
    this.nextOccurrence = nextOccurrence;
    this.updatedAt = Instant.now();
  }

  /** Moves an active task to its next due date. */
  public void advanceTo(LocalDate nextOccurrence) {
    requireStatus(RecurringTaskStatus.ACTIVE, "advance");
    this.nextOccurrence = nextOccurrence;
    this.updatedAt = Instant.now();
  }

  /** Appends a closed cycle to the history. */
  public void recordCycle(LocalDate occurrence, String completedBy, Instant completedAt) {
    this.cycleHistory.add(new CycleCompletion(occurrence, completedBy, completedAt));
    this.updatedAt = Instant.now();
  }

  /** Marks the schedule as finished; the last due date is kept. */
  public void complete() {
    this.status = RecurringTaskStatus.COMPLETED;
    this.updatedAt = Instant.now();
  }

  public boolean isEndedBefore(LocalDate date) {
    return endDate != null && date.isAfter(endDate);
  }

  private void requireStatus(RecurringTaskStatus expected, String action) {
    if (status != expected) {
      throw new InvalidStateException(
          "Invalid task status",
          "Cannot "
              + action
              + " a recurring task in status "
              + status
              + " (expected "
              + expected
              + ")");
    }
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public String getCategory() {
    return category;
  }

  public RecurrencePattern getRecurrencePattern() {
    return recurrencePattern;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public LocalDate getNextOccurrence() {
    return nextOccurrence;
  }

  public RecurringTaskStatus getStatus() {
    return status;
  }

  public boolean isRequiresArn() {
    return requiresArn;
  }

  public Set<String> getAssignedClientIds() {
    return Collections.unmodifiableSet(assignedClientIds);
  }

  public List<TeamMemberMapping> getTeamMemberMappings() {
    return Collections.unmodifiableList(teamMemberMappings);
  }

  public List<CycleCompletion> getCycleHistory() {
    return Collections.unmodifiableList(cycleHistory);
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
