package io.b2mash.b2b.taskengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a recurrence pattern value is not one of the supported cadences. */
public class InvalidPatternException extends ErrorResponseException {

  public InvalidPatternException(String pattern) {
    super(HttpStatus.BAD_REQUEST, createProblem(pattern), null);
  }

  private static ProblemDetail createProblem(String pattern) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid recurrence pattern");
    problem.setDetail(
        "Unsupported recurrence pattern: "
            + pattern
            + ". Expected one of daily, weekly, monthly, quarterly, half-yearly, yearly.");
    problem.setProperty("pattern", pattern);
    return problem;
  }
}
