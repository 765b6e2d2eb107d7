package io.forgecascade.governance.proposal;

import io.forgecascade.governance.audit.AuditEventBuilder;
import io.forgecascade.governance.audit.AuditService;
import io.forgecascade.governance.config.GovernanceProperties;
import io.forgecascade.governance.electorate.VotingWeightProvider;
import io.forgecascade.governance.exception.ForbiddenException;
import io.forgecascade.governance.exception.InvalidStateException;
import io.forgecascade.governance.exception.ResourceNotFoundException;
import io.forgecascade.governance.proposal.dto.CreateProposalCommand;
import io.forgecascade.governance.proposal.dto.ProposalFilterCriteria;
import io.forgecascade.governance.proposal.dto.ProposalStats;
import io.forgecascade.governance.vote.VoteRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Authoring and read side of proposals. Status changes live in {@link ProposalLifecycleService}. */
@Service
public class ProposalService {

  private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

  static final BigDecimal MIN_QUORUM = new BigDecimal("0.01");
  static final BigDecimal MIN_THRESHOLD = new BigDecimal("0.50");
  static final int MIN_VOTING_PERIOD_DAYS = 1;

  private final ProposalRepository proposalRepository;
  private final VoteRepository voteRepository;
  private final VotingWeightProvider votingWeightProvider;
  private final AuditService auditService;
  private final GovernanceProperties properties;
  private final Clock clock;

  public ProposalService(
      ProposalRepository proposalRepository,
      VoteRepository voteRepository,
      VotingWeightProvider votingWeightProvider,
      AuditService auditService,
      GovernanceProperties properties,
      Clock clock) {
    this.proposalRepository = proposalRepository;
    this.voteRepository = voteRepository;
    this.votingWeightProvider = votingWeightProvider;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional
  public Proposal createProposal(CreateProposalCommand command) {
    var voting = properties.voting();
    BigDecimal quorum =
        command.quorumPercentage() != null
            ? command.quorumPercentage()
            : voting.defaultQuorumPercentage();
    BigDecimal threshold =
        command.approvalThreshold() != null
            ? command.approvalThreshold()
            : voting.defaultApprovalThreshold();
    int periodDays =
        command.votingPeriodDays() != null
            ? command.votingPeriodDays()
            : (int) voting.defaultPeriod().toDays();

    validateVotingSettings(quorum, threshold, periodDays);
    ProposalPayloadValidator.validate(command.type(), command.payload());

    var proposal =
        new Proposal(
            command.title(),
            command.description(),
            command.type(),
            command.payload(),
            command.proposerId(),
            periodDays,
            quorum,
            threshold,
            clock.instant());
    var saved = proposalRepository.save(proposal);

    var auditDetails = new LinkedHashMap<String, Object>();
    auditDetails.put("title", saved.getTitle());
    auditDetails.put("type", saved.getType().name());
    auditDetails.put("quorum_percentage", quorum.toPlainString());
    auditDetails.put("approval_threshold", threshold.toPlainString());
    auditDetails.put("voting_period_days", periodDays);
    auditService.log(
        AuditEventBuilder.proposal(saved.getId(), "created")
            .details(auditDetails)
            .build());

    log.info(
        "Created proposal {} ({}) by proposer {}",
        saved.getId(),
        saved.getType(),
        saved.getProposerId());
    return saved;
  }

  /** Proposer-only edit of a DRAFT. Null fields are left unchanged. */
  @Transactional
  public Proposal updateProposal(
      UUID proposalId,
      UUID actorId,
      String title,
      String description,
      Map<String, Object> payload) {
    var proposal =
        proposalRepository
            .findByIdForUpdate(proposalId)
            .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
    if (!proposal.isProposer(actorId)) {
      throw new ForbiddenException(
          "Not the proposer", "Only the proposer can edit proposal " + proposalId);
    }
    if (payload != null) {
      ProposalPayloadValidator.validate(proposal.getType(), payload);
    }

    proposal.updateContent(title, description, payload, clock.instant());

    var changed = new LinkedHashMap<String, Object>();
    if (title != null) {
      changed.put("title", title);
    }
    if (description != null) {
      changed.put("description_changed", true);
    }
    if (payload != null) {
      changed.put("payload_changed", true);
    }
    auditService.log(
        AuditEventBuilder.proposal(proposalId, "updated")
            .details(changed)
            .build());

    log.info("Updated draft proposal {}", proposalId);
    return proposal;
  }

  @Transactional(readOnly = true)
  public Proposal getProposal(UUID proposalId) {
    return proposalRepository
        .findById(proposalId)
        .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
  }

  @Transactional(readOnly = true)
  public Page<Proposal> listProposals(ProposalFilterCriteria criteria, Pageable pageable) {
    return proposalRepository.findFiltered(
        criteria.status(), criteria.type(), criteria.proposerId(), pageable);
  }

  /** ACTIVE proposals, soonest deadline first. */
  @Transactional(readOnly = true)
  public List<Proposal> listActiveProposals() {
    return proposalRepository.findByStatusOrderByVotingEndsAtAsc(ProposalStatus.ACTIVE);
  }

  @Transactional(readOnly = true)
  public ProposalStats getStats() {
    var byStatus = new EnumMap<ProposalStatus, Long>(ProposalStatus.class);
    for (var status : ProposalStatus.values()) {
      byStatus.put(status, 0L);
    }
    long total = 0;
    for (var row : proposalRepository.countByStatusGrouped()) {
      byStatus.put(row.getStatus(), row.getCount());
      total += row.getCount();
    }

    Double participation = proposalRepository.averageParticipation();
    Double approval = proposalRepository.averageApprovalRatio();

    return new ProposalStats(
        total,
        byStatus,
        voteRepository.count(),
        voteRepository.countDistinctVoters(),
        votingWeightProvider.eligibleVoterCount(),
        participation != null ? participation : 0.0,
        approval != null ? approval : 0.0);
  }

  private void validateVotingSettings(BigDecimal quorum, BigDecimal threshold, int periodDays) {
    if (quorum.compareTo(MIN_QUORUM) < 0 || quorum.compareTo(BigDecimal.ONE) > 0) {
      throw new InvalidStateException(
          "Invalid quorum", "Quorum percentage must be between 0.01 and 1.0, got " + quorum);
    }
    if (threshold.compareTo(MIN_THRESHOLD) < 0 || threshold.compareTo(BigDecimal.ONE) > 0) {
      throw new InvalidStateException(
          "Invalid approval threshold",
          "Approval threshold must be between 0.5 and 1.0, got " + threshold);
    }
    long maxDays = properties.voting().maxPeriod().toDays();
    if (periodDays < MIN_VOTING_PERIOD_DAYS || periodDays > maxDays) {
      throw new InvalidStateException(
          "Invalid voting period",
          "Voting period must be between 1 and " + maxDays + " days, got " + periodDays);
    }
  }
}
