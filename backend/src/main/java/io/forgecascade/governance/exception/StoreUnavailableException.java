package io.forgecascade.governance.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The backing store timed out or could not be reached. The operation did not commit and is safe
 * to retry with backoff.
 */
public class StoreUnavailableException extends ErrorResponseException {

  public StoreUnavailableException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Store unavailable");
    problem.setDetail(detail);
    problem.setProperty(ErrorCodes.PROPERTY, ErrorCodes.STORE_UNAVAILABLE);
    problem.setProperty("retryable", true);
    return problem;
  }
}
