package io.forgecascade.governance.vote;

import io.forgecascade.governance.exception.ResourceNotFoundException;
import io.forgecascade.governance.proposal.Proposal;
import io.forgecascade.governance.proposal.ProposalRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rebuilds a proposal's six tally fields from every vote on it. Never adds to the stored values, so
 * a revote replaces the voter's earlier contribution and repeated runs give the same result.
 */
@Service
public class TallyAggregator {

  private static final Logger log = LoggerFactory.getLogger(TallyAggregator.class);

  private final VoteRepository voteRepository;
  private final ProposalRepository proposalRepository;

  public TallyAggregator(VoteRepository voteRepository, ProposalRepository proposalRepository) {
    this.voteRepository = voteRepository;
    this.proposalRepository = proposalRepository;
  }

  @Transactional
  public VoteTally recalculate(UUID proposalId) {
    var proposal =
        proposalRepository
            .findByIdForUpdate(proposalId)
            .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
    return applyTo(proposal);
  }

  /**
   * Applies the ledger's tally to a proposal the caller has already locked. Must run inside the
   * caller's transaction so the tally commits together with the vote that triggered it.
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public VoteTally applyTo(Proposal proposal) {
    var tally = VoteTally.from(voteRepository.sumByDecision(proposal.getId()));
    if (proposal.applyTally(tally)) {
      log.debug(
          "Tally updated for proposal {}: for={}/{}, against={}/{}, abstain={}/{}",
          proposal.getId(),
          tally.votesFor(),
          tally.weightFor(),
          tally.votesAgainst(),
          tally.weightAgainst(),
          tally.votesAbstain(),
          tally.weightAbstain());
    }
    return tally;
  }
}
