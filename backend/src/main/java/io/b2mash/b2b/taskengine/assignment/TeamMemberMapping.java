package io.b2mash.b2b.taskengine.assignment;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Clients of a recurring task that one employee is responsible for. Stored as part of the task's
 * JSON mapping list.
 */
public record TeamMemberMapping(String employeeId, String employeeName, Set<String> clientIds) {

  public TeamMemberMapping {
    Objects.requireNonNull(employeeId, "employeeId");
    clientIds =
        clientIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(clientIds));
  }
}
