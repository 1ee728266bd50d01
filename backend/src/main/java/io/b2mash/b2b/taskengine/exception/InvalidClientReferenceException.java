package io.b2mash.b2b.taskengine.exception;

import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a team member mapping references clients that are not assigned to the recurring
 * task. Results in HTTP 400 with the offending client ids.
 */
public class InvalidClientReferenceException extends ErrorResponseException {

  private final Set<String> unknownClientIds;

  public InvalidClientReferenceException(String employeeId, Set<String> unknownClientIds) {
    super(HttpStatus.BAD_REQUEST, createProblem(employeeId, unknownClientIds), null);
    this.unknownClientIds = Set.copyOf(unknownClientIds);
  }

  public Set<String> getUnknownClientIds() {
    return unknownClientIds;
  }

  private static ProblemDetail createProblem(String employeeId, Set<String> unknownClientIds) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid client reference");
    problem.setDetail(
        "Mapping for employee "
            + employeeId
            + " references clients not assigned to this task: "
            + unknownClientIds);
    problem.setProperty("unknownClientIds", unknownClientIds);
    return problem;
  }
}
