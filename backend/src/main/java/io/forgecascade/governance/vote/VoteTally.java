package io.forgecascade.governance.vote;

import java.util.List;

/**
 * Counts and weighted sums per decision for one proposal, computed from the full vote ledger.
 */
public record VoteTally(
    int votesFor,
    int votesAgainst,
    int votesAbstain,
    double weightFor,
    double weightAgainst,
    double weightAbstain) {

  public static final VoteTally EMPTY = new VoteTally(0, 0, 0, 0.0, 0.0, 0.0);

  /** Folds the per-decision rows of {@link VoteRepository#sumByDecision}. */
  public static VoteTally from(List<VoteRepository.DecisionSum> rows) {
    int votesFor = 0;
    int votesAgainst = 0;
    int votesAbstain = 0;
    double weightFor = 0.0;
    double weightAgainst = 0.0;
    double weightAbstain = 0.0;
    for (var row : rows) {
      int count = Math.toIntExact(row.getVoteCount());
      double weight = row.getTotalWeight() != null ? row.getTotalWeight() : 0.0;
      switch (row.getDecision()) {
        case FOR -> {
          votesFor = count;
          weightFor = weight;
        }
        case AGAINST -> {
          votesAgainst = count;
          weightAgainst = weight;
        }
        case ABSTAIN -> {
          votesAbstain = count;
          weightAbstain = weight;
        }
      }
    }
    return new VoteTally(
        votesFor, votesAgainst, votesAbstain, weightFor, weightAgainst, weightAbstain);
  }

  public int totalVotes() {
    return votesFor + votesAgainst + votesAbstain;
  }

  public double participationWeight() {
    return weightFor + weightAgainst + weightAbstain;
  }
}
