package io.forgecascade.governance.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A requested state change is not allowed from the proposal's current status. The caller should
 * re-fetch the proposal before deciding what to do next.
 */
public class InvalidTransitionException extends ErrorResponseException {

  public InvalidTransitionException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(ErrorCodes.PROPERTY, ErrorCodes.INVALID_TRANSITION);
    return problem;
  }
}
