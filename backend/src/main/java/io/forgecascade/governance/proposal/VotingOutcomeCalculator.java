package io.forgecascade.governance.proposal;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Decides PASSED, REJECTED or EXPIRED from weighted sums.
 *
 * <p>Quorum is measured in weight against the electorate snapshot. Abstentions count toward quorum
 * but are left out of the approval ratio. Comparisons are done in {@link BigDecimal} so that an
 * exact boundary (30 of 100 at quorum 0.30) is met rather than lost to binary rounding.
 */
public final class VotingOutcomeCalculator {

  private VotingOutcomeCalculator() {}

  public static VotingOutcome evaluate(
      double weightFor,
      double weightAgainst,
      double weightAbstain,
      double totalEligibleWeight,
      BigDecimal quorumPercentage,
      BigDecimal approvalThreshold) {
    BigDecimal forWeight = BigDecimal.valueOf(weightFor);
    BigDecimal againstWeight = BigDecimal.valueOf(weightAgainst);
    BigDecimal participation = forWeight.add(againstWeight).add(BigDecimal.valueOf(weightAbstain));
    BigDecimal electorate = BigDecimal.valueOf(totalEligibleWeight);

    // No known electorate: a proposal cannot pass.
    if (electorate.signum() <= 0 || participation.signum() <= 0) {
      return new VotingOutcome(ProposalStatus.EXPIRED, participation, false, null);
    }

    boolean quorumMet = participation.compareTo(quorumPercentage.multiply(electorate)) >= 0;
    if (!quorumMet) {
      return new VotingOutcome(ProposalStatus.EXPIRED, participation, false, null);
    }

    BigDecimal decisive = forWeight.add(againstWeight);
    if (decisive.signum() == 0) {
      return new VotingOutcome(ProposalStatus.REJECTED, participation, true, null);
    }

    BigDecimal ratio = forWeight.divide(decisive, MathContext.DECIMAL64);
    boolean approved = forWeight.compareTo(approvalThreshold.multiply(decisive)) >= 0;
    return new VotingOutcome(
        approved ? ProposalStatus.PASSED : ProposalStatus.REJECTED, participation, true, ratio);
  }

  public static VotingOutcome evaluate(Proposal proposal) {
    return evaluate(
        proposal.getWeightFor(),
        proposal.getWeightAgainst(),
        proposal.getWeightAbstain(),
        proposal.getTotalEligibleWeight(),
        proposal.getQuorumPercentage(),
        proposal.getApprovalThreshold());
  }
}
