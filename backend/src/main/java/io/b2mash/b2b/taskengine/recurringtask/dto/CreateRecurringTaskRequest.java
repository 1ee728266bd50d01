package io.b2mash.b2b.taskengine.recurringtask.dto;

import io.b2mash.b2b.taskengine.recurringtask.TaskPriority;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public record CreateRecurringTaskRequest(
    @NotBlank @Size(max = 200) String title,
    @Size(max = 1000) String description,
    TaskPriority priority,
    @Size(max = 100) String category,
    @NotBlank String recurrencePattern,
    @NotNull LocalDate startDate,
    LocalDate endDate,
    boolean requiresArn,
    @NotNull Set<@NotBlank String> assignedClientIds,
    List<@Valid MappingRequest> teamMemberMappings) {}
