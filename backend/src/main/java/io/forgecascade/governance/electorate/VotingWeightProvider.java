package io.forgecascade.governance.electorate;

import java.util.UUID;

/** Source of voting weight. Voting math only ever sees the numbers returned here. */
public interface VotingWeightProvider {

  /**
   * Current weight of an eligible voter.
   *
   * @throws io.forgecascade.governance.exception.ForbiddenException if the voter is unknown,
   *     inactive or below the minimum trust score
   */
  double currentWeight(UUID voterId);

  /** Sum of the current weights of every eligible voter. */
  double totalEligibleWeight();

  /** Number of members currently allowed to vote. */
  long eligibleVoterCount();
}
