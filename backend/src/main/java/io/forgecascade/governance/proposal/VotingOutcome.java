package io.forgecascade.governance.proposal;

import java.math.BigDecimal;

/**
 * Result of evaluating a tally at close.
 *
 * @param status PASSED, REJECTED or EXPIRED
 * @param participationWeight for + against + abstain
 * @param quorumMet participation reached {@code quorum * totalEligibleWeight}
 * @param approvalRatio for / (for + against); null when there was no decisive weight
 */
public record VotingOutcome(
    ProposalStatus status,
    BigDecimal participationWeight,
    boolean quorumMet,
    BigDecimal approvalRatio) {}
