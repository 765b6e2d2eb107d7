package io.forgecascade.governance.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A vote would push the weight cast on a proposal past the electorate weight captured when voting
 * opened.
 */
public class ElectorateWeightExceededException extends ErrorResponseException {

  public ElectorateWeightExceededException(
      UUID proposalId, double participation, double totalEligibleWeight) {
    super(
        HttpStatus.CONFLICT,
        createProblem(proposalId, participation, totalEligibleWeight),
        null);
  }

  private static ProblemDetail createProblem(
      UUID proposalId, double participation, double totalEligibleWeight) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Electorate weight exceeded");
    problem.setDetail(
        "Vote would bring participation on proposal "
            + proposalId
            + " to "
            + participation
            + ", above the eligible weight of "
            + totalEligibleWeight);
    problem.setProperty(ErrorCodes.PROPERTY, ErrorCodes.ELECTORATE_WEIGHT_EXCEEDED);
    problem.setProperty("proposalId", proposalId);
    problem.setProperty("totalEligibleWeight", totalEligibleWeight);
    return problem;
  }
}
