package io.b2mash.b2b.taskengine.recurringtask.dto;

import io.b2mash.b2b.taskengine.assignment.TeamMemberMapping;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Set;

/**
 * One employee's client list. {@code employeeId} is ignored on the single-mapping endpoint, where
 * the path carries it.
 */
public record MappingRequest(
    String employeeId, @NotBlank String employeeName, @NotNull Set<@NotBlank String> clientIds) {

  public TeamMemberMapping toMapping() {
    return new TeamMemberMapping(employeeId, employeeName, clientIds);
  }
}
