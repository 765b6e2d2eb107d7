package io.forgecascade.governance.vote;

import io.forgecascade.governance.audit.AuditEventBuilder;
import io.forgecascade.governance.audit.AuditService;
import io.forgecascade.governance.electorate.VotingWeightProvider;
import io.forgecascade.governance.exception.ElectorateWeightExceededException;
import io.forgecascade.governance.exception.ProposalNotActiveException;
import io.forgecascade.governance.exception.ResourceNotFoundException;
import io.forgecascade.governance.proposal.ProposalRepository;
import io.forgecascade.governance.proposal.ProposalStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class VoteService {

  private static final Logger log = LoggerFactory.getLogger(VoteService.class);

  private final VoteRepository voteRepository;
  private final ProposalRepository proposalRepository;
  private final TallyAggregator tallyAggregator;
  private final VotingWeightProvider votingWeightProvider;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public VoteService(
      VoteRepository voteRepository,
      ProposalRepository proposalRepository,
      TallyAggregator tallyAggregator,
      VotingWeightProvider votingWeightProvider,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.voteRepository = voteRepository;
    this.proposalRepository = proposalRepository;
    this.tallyAggregator = tallyAggregator;
    this.votingWeightProvider = votingWeightProvider;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Casts with the voter's current weight from the electorate. */
  @Transactional
  public CastResult castVote(
      UUID proposalId, UUID voterId, VoteDecision decision, String reasoning) {
    double weight = votingWeightProvider.currentWeight(voterId);
    return castVote(proposalId, voterId, decision, weight, reasoning);
  }

  /**
   * Creates the voter's vote, or revises it in place if one exists, then rebuilds the proposal
   * tally in the same transaction.
   *
   * <p>The proposal row lock serializes every vote on the proposal, so the existence check cannot
   * race a concurrent insert by the same voter. The unique index backs this up.
   *
   * <p>The stored tally is current under the lock, so the weight cast after this vote is known
   * before anything is written. A vote that would take it past the electorate snapshot is refused.
   */
  @Transactional
  public CastResult castVote(
      UUID proposalId, UUID voterId, VoteDecision decision, double weight, String reasoning) {
    if (weight < 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
      throw new IllegalArgumentException("Vote weight must be a finite non-negative number");
    }
    var proposal =
        proposalRepository
            .findByIdForUpdate(proposalId)
            .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));

    Instant now = clock.instant();
    if (!proposal.isVotingOpen(now)) {
      String reason =
          proposal.getStatus() == ProposalStatus.ACTIVE
              ? "voting ended at " + proposal.getVotingEndsAt()
              : "status is " + proposal.getStatus();
      throw new ProposalNotActiveException(proposalId, reason);
    }

    var existing = voteRepository.findByProposalIdAndVoterId(proposalId, voterId);
    boolean revote = existing.isPresent();

    double participation =
        proposal.getParticipationWeight() - existing.map(Vote::getWeight).orElse(0.0) + weight;
    if (!proposal.isWithinElectorate(participation)) {
      log.warn(
          "Rejected vote on proposal {} by {}: participation {} would exceed eligible weight {}",
          proposalId,
          voterId,
          participation,
          proposal.getTotalEligibleWeight());
      throw new ElectorateWeightExceededException(
          proposalId, participation, proposal.getTotalEligibleWeight());
    }

    VoteDecision previousDecision = null;
    Vote vote;
    if (revote) {
      vote = existing.get();
      previousDecision = vote.getDecision();
      vote.revise(decision, weight, reasoning, now);
    } else {
      vote = new Vote(proposalId, voterId, decision, weight, reasoning, now);
    }
    vote = voteRepository.saveAndFlush(vote);

    var tally = tallyAggregator.applyTo(proposal);

    var details = new LinkedHashMap<String, Object>();
    details.put("decision", decision.name());
    details.put("weight", weight);
    if (previousDecision != null) {
      details.put("previous_decision", previousDecision.name());
    }
    auditService.log(
        AuditEventBuilder.vote(vote.getId(), proposalId, revote ? "changed" : "cast")
            .actor(voterId)
            .details(details)
            .build());

    eventPublisher.publishEvent(new VoteCastEvent(proposalId, voterId, decision, weight, revote));

    log.info(
        "{} on proposal {} by {}: {} (weight {}); tally for={}, against={}, abstain={}",
        revote ? "Vote changed" : "Vote cast",
        proposalId,
        voterId,
        decision,
        weight,
        tally.weightFor(),
        tally.weightAgainst(),
        tally.weightAbstain());
    return new CastResult(vote, revote);
  }

  @Transactional(readOnly = true)
  public Optional<Vote> getVote(UUID proposalId, UUID voterId) {
    return voteRepository.findByProposalIdAndVoterId(proposalId, voterId);
  }

  @Transactional(readOnly = true)
  public Vote requireVote(UUID proposalId, UUID voterId) {
    return getVote(proposalId, voterId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Vote",
                    "No vote by " + voterId + " on proposal " + proposalId));
  }

  /** Votes on a proposal in creation order. */
  @Transactional(readOnly = true)
  public List<Vote> listVotes(UUID proposalId) {
    if (!proposalRepository.existsById(proposalId)) {
      throw new ResourceNotFoundException("Proposal", proposalId);
    }
    return voteRepository.findByProposalIdOrderByCreatedAtAscIdAsc(proposalId);
  }

  @Transactional(readOnly = true)
  public Page<Vote> listVoterHistory(UUID voterId, Pageable pageable) {
    return voteRepository.findByVoterIdOrderByUpdatedAtDesc(voterId, pageable);
  }

  /** @param revote true when an existing vote was revised rather than created */
  public record CastResult(Vote vote, boolean revote) {}
}
