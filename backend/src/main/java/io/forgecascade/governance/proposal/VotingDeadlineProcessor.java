package io.forgecascade.governance.proposal;

import io.forgecascade.governance.config.GovernanceProperties;
import io.forgecascade.governance.metrics.GovernanceMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Closes ACTIVE proposals whose voting window has ended. Each proposal closes in its own
 * transaction; one that fails stays ACTIVE and is picked up again by a later sweep, after the due
 * proposals that have not failed.
 */
@Component
public class VotingDeadlineProcessor {

  private static final Logger log = LoggerFactory.getLogger(VotingDeadlineProcessor.class);

  private final ProposalRepository proposalRepository;
  private final ProposalLifecycleService lifecycleService;
  private final GovernanceMetrics metrics;
  private final GovernanceProperties properties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public VotingDeadlineProcessor(
      ProposalRepository proposalRepository,
      ProposalLifecycleService lifecycleService,
      GovernanceMetrics metrics,
      GovernanceProperties properties,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.proposalRepository = proposalRepository;
    this.lifecycleService = lifecycleService;
    this.metrics = metrics;
    this.properties = properties;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${governance.deadline.sweep-interval:PT1M}",
      initialDelayString = "${governance.deadline.sweep-interval:PT1M}")
  public void scheduledSweep() {
    sweep();
  }

  public SweepResult sweep() {
    var deadline = properties.deadline();
    Instant started = clock.instant();
    List<UUID> due = findDue(started, deadline.batchSize());
    if (due.isEmpty()) {
      log.debug("Voting deadline sweep: nothing due");
      return new SweepResult(0, 0, 0);
    }

    int closed = 0;
    int failed = 0;
    int deferred = 0;
    for (int i = 0; i < due.size(); i++) {
      if (Duration.between(started, clock.instant()).compareTo(deadline.maxSweepDuration()) >= 0) {
        deferred = due.size() - i;
        log.warn(
            "Voting deadline sweep hit its {} time budget; {} proposals deferred to next sweep",
            deadline.maxSweepDuration(),
            deferred);
        break;
      }
      UUID proposalId = due.get(i);
      try {
        if (lifecycleService.closeVotingIfDue(proposalId)) {
          closed++;
        }
      } catch (Exception e) {
        failed++;
        log.warn("Failed to close proposal {}; will retry on next sweep", proposalId, e);
        recordFailure(proposalId);
      }
    }

    metrics.recordSweep(closed, failed);
    log.info(
        "Voting deadline sweep completed: due={}, closed={}, failed={}, deferred={}",
        due.size(),
        closed,
        failed,
        deferred);
    return new SweepResult(closed, failed, deferred);
  }

  /** Moves the proposal behind never-failed ones in the next batch. */
  private void recordFailure(UUID proposalId) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> proposalRepository.recordCloseFailure(proposalId, clock.instant()));
    } catch (RuntimeException e) {
      log.warn("Could not record close failure for proposal {}", proposalId, e);
    }
  }

  private List<UUID> findDue(Instant now, int batchSize) {
    List<UUID> ids =
        transactionTemplate.execute(
            status ->
                proposalRepository.findDueProposalIds(
                    ProposalStatus.ACTIVE, now, PageRequest.of(0, batchSize)));
    return ids != null ? ids : List.of();
  }

  /**
   * @param closed proposals moved to a terminal status by this sweep
   * @param failed proposals whose closure threw; still ACTIVE
   * @param deferred due proposals not attempted because the time budget ran out
   */
  public record SweepResult(int closed, int failed, int deferred) {}
}
