package io.forgecascade.governance.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A proposal payload names an action that is unknown, incomplete or forbidden for its type. */
public class InvalidPayloadException extends ErrorResponseException {

  public InvalidPayloadException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(ErrorCodes.PROPERTY, ErrorCodes.INVALID_PAYLOAD);
    return problem;
  }
}
