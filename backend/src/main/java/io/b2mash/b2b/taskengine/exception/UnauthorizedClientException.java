package io.b2mash.b2b.taskengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when an actor addresses a client outside their visible client set. HTTP 403. */
public class UnauthorizedClientException extends ErrorResponseException {

  public UnauthorizedClientException(String actorId, String clientId) {
    super(HttpStatus.FORBIDDEN, createProblem(actorId, clientId), null);
  }

  private static ProblemDetail createProblem(String actorId, String clientId) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Client not assigned");
    problem.setDetail("You are not assigned client " + clientId + " on this task");
    problem.setProperty("clientId", clientId);
    problem.setProperty("actorId", actorId);
    return problem;
  }
}
