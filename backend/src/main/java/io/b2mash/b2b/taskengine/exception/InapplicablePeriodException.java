package io.b2mash.b2b.taskengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a completion is addressed to a period key that is malformed or not applicable under
 * the task's recurrence pattern. Results in HTTP 422 Unprocessable Entity.
 */
public class InapplicablePeriodException extends ErrorResponseException {

  public InapplicablePeriodException(String periodKey, String pattern) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(
            "Period " + periodKey + " is not applicable to a " + pattern + " task", periodKey),
        null);
  }

  private InapplicablePeriodException(ProblemDetail problem) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, problem, null);
  }

  public static InapplicablePeriodException malformed(String periodKey) {
    return new InapplicablePeriodException(
        createProblem("Period key must have the form YYYY-MM, got: " + periodKey, periodKey));
  }

  private static ProblemDetail createProblem(String detail, String periodKey) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Inapplicable period");
    problem.setDetail(detail);
    problem.setProperty("periodKey", periodKey);
    return problem;
  }
}
