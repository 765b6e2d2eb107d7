package io.forgecascade.governance.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidDecisionException extends ErrorResponseException {

  public InvalidDecisionException(String value, List<String> accepted) {
    super(HttpStatus.BAD_REQUEST, createProblem(value, accepted), null);
  }

  private static ProblemDetail createProblem(String value, List<String> accepted) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid vote decision");
    problem.setDetail("'" + value + "' is not a valid decision. Accepted: " + accepted);
    problem.setProperty(ErrorCodes.PROPERTY, ErrorCodes.INVALID_DECISION);
    return problem;
  }
}
