package io.forgecascade.governance.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A vote was attempted while the proposal is not accepting votes: it is not ACTIVE, or its voting
 * window has already ended.
 */
public class ProposalNotActiveException extends ErrorResponseException {

  public ProposalNotActiveException(UUID proposalId, String reason) {
    super(HttpStatus.CONFLICT, createProblem(proposalId, reason), null);
  }

  private static ProblemDetail createProblem(UUID proposalId, String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Proposal not active");
    problem.setDetail("Proposal " + proposalId + " is not accepting votes: " + reason);
    problem.setProperty(ErrorCodes.PROPERTY, ErrorCodes.PROPOSAL_NOT_ACTIVE);
    problem.setProperty("proposalId", proposalId);
    return problem;
  }
}
