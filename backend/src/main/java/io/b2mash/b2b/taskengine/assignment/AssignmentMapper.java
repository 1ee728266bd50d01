package io.b2mash.b2b.taskengine.assignment;

import io.b2mash.b2b.taskengine.exception.InvalidClientReferenceException;
import io.b2mash.b2b.taskengine.exception.InvalidStateException;
import io.b2mash.b2b.taskengine.exception.UnauthorizedClientException;
import io.b2mash.b2b.taskengine.recurringtask.RecurringTask;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Resolves which clients of a recurring task a viewer may see and act on, and maintains the task's
 * employee-to-clients mapping list.
 *
 * <p>Resolution order: admins and managers see every assigned client; an employee with a mapping
 * sees that mapping's clients; on a task without any mapping every employee sees every assigned
 * client; otherwise the employee sees nothing.
 */
@Component
public class AssignmentMapper {

  public Set<String> visibleClientIds(RecurringTask task, Viewer viewer) {
    if (viewer.isPrivileged()) {
      return task.getAssignedClientIds();
    }
    List<TeamMemberMapping> mappings = task.getTeamMemberMappings();
    if (mappings.isEmpty()) {
      return task.getAssignedClientIds();
    }
    return mappings.stream()
        .filter(m -> m.employeeId().equals(viewer.actorId()))
        .findFirst()
        .map(TeamMemberMapping::clientIds)
        .orElse(Set.of());
  }

  /** Privileged viewers see every task, including tasks with no clients. */
  public boolean isTaskVisible(RecurringTask task, Viewer viewer) {
    return viewer.isPrivileged() || !visibleClientIds(task, viewer).isEmpty();
  }

  /**
   * Throws unless {@code clientId} is in the viewer's visible set for the task.
   *
   * @throws UnauthorizedClientException if the viewer cannot act on the client
   */
  public void requireVisibleClient(RecurringTask task, Viewer viewer, String clientId) {
    if (!visibleClientIds(task, viewer).contains(clientId)) {
      throw new UnauthorizedClientException(viewer.actorId(), clientId);
    }
  }

  /**
   * Inserts or replaces the mapping of one employee. An existing entry keeps its position in the
   * list. Clients may be shared with other employees.
   *
   * @throws InvalidClientReferenceException if a client is not assigned to the task
   */
  public void addOrUpdateMapping(
      RecurringTask task, String employeeId, String employeeName, Collection<String> clientIds) {
    var mapping = new TeamMemberMapping(employeeId, employeeName, new LinkedHashSet<>(clientIds));
    validate(task.getAssignedClientIds(), mapping);

    var updated = new ArrayList<TeamMemberMapping>(task.getTeamMemberMappings());
    boolean replaced = false;
    for (int i = 0; i < updated.size(); i++) {
      if (updated.get(i).employeeId().equals(employeeId)) {
        updated.set(i, mapping);
        replaced = true;
        break;
      }
    }
    if (!replaced) {
      updated.add(mapping);
    }
    task.replaceTeamMemberMappings(updated);
  }

  /**
   * Removes the mapping of one employee. Removing an absent mapping is a no-op.
   *
   * @return true if a mapping was removed
   */
  public boolean removeMapping(RecurringTask task, String employeeId) {
    var updated =
        task.getTeamMemberMappings().stream()
            .filter(m -> !m.employeeId().equals(employeeId))
            .toList();
    if (updated.size() == task.getTeamMemberMappings().size()) {
      return false;
    }
    task.replaceTeamMemberMappings(updated);
    return true;
  }

  /**
   * Validates and swaps in a whole mapping list. Nothing is changed when any entry is invalid.
   *
   * @throws InvalidClientReferenceException if an entry references an unassigned client
   * @throws InvalidStateException if an employee appears twice
   */
  public void replaceMappings(RecurringTask task, List<TeamMemberMapping> mappings) {
    validateAll(task.getAssignedClientIds(), mappings);
    task.replaceTeamMemberMappings(mappings);
  }

  /** Checks every mapping against an assigned-client set, e.g. before shrinking that set. */
  public void validateAll(Set<String> assignedClientIds, List<TeamMemberMapping> mappings) {
    var seen = new HashSet<String>();
    for (TeamMemberMapping mapping : mappings) {
      if (!seen.add(mapping.employeeId())) {
        throw new InvalidStateException(
            "Duplicate mapping",
            "Employee " + mapping.employeeId() + " appears more than once in the mapping list");
      }
      validate(assignedClientIds, mapping);
    }
  }

  private void validate(Set<String> assignedClientIds, TeamMemberMapping mapping) {
    var unknown = new LinkedHashSet<>(mapping.clientIds());
    unknown.removeAll(assignedClientIds);
    if (!unknown.isEmpty()) {
      throw new InvalidClientReferenceException(mapping.employeeId(), unknown);
    }
  }
}
