package io.b2mash.b2b.taskengine.recurringtask.dto;

import io.b2mash.b2b.taskengine.assignment.TeamMemberMapping;
import io.b2mash.b2b.taskengine.recurringtask.CycleCompletion;
import io.b2mash.b2b.taskengine.recurringtask.RecurringTask;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A recurring task as seen by one viewer. {@code visibleClientIds} is the subset of assigned
 * clients the viewer may act on.
 */
public record RecurringTaskResponse(
    UUID id,
    String title,
    String description,
    String priority,
    String category,
    String recurrencePattern,
    String recurrenceDescription,
    LocalDate startDate,
    LocalDate endDate,
    LocalDate nextOccurrence,
    String status,
    boolean requiresArn,
    Set<String> assignedClientIds,
    List<TeamMemberMapping> teamMemberMappings,
    Set<String> visibleClientIds,
    List<CycleCompletion> cycleHistory,
    String createdBy,
    Instant createdAt,
    Instant updatedAt) {

  public static RecurringTaskResponse from(RecurringTask task, Set<String> visibleClientIds) {
    return new RecurringTaskResponse(
        task.getId(),
        task.getTitle(),
        task.getDescription(),
        task.getPriority().name(),
        task.getCategory(),
        task.getRecurrencePattern().value(),
        task.getRecurrencePattern().description(),
        task.getStartDate(),
        task.getEndDate(),
        task.getNextOccurrence(),
        task.getStatus().name(),
        task.isRequiresArn(),
        task.getAssignedClientIds(),
        task.getTeamMemberMappings(),
        visibleClientIds,
        task.getCycleHistory(),
        task.getCreatedBy(),
        task.getCreatedAt(),
        task.getUpdatedAt());
  }
}
