package io.forgecascade.governance.proposal;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProposalRepository extends JpaRepository<Proposal, UUID> {

  /** Row-locks the proposal so votes, tally writes and closure on it run one at a time. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Proposal p WHERE p.id = :id")
  Optional<Proposal> findByIdForUpdate(@Param("id") UUID id);

  /**
   * IDs of proposals in {@code status} whose deadline is at or before {@code now}. Proposals that
   * never failed to close come first, soonest deadline first; the rest follow by least recent
   * failure, so a run of failing proposals cannot keep the others out of a batch.
   */
  @Query(
      """
      SELECT p.id FROM Proposal p
      WHERE p.status = :status
        AND p.votingEndsAt IS NOT NULL
        AND p.votingEndsAt <= :now
      ORDER BY p.lastCloseFailureAt ASC NULLS FIRST, p.votingEndsAt ASC
      """)
  List<UUID> findDueProposalIds(
      @Param("status") ProposalStatus status, @Param("now") Instant now, Pageable pageable);

  /** Counts a failed close attempt. Bulk update, so it neither reads nor bumps the version. */
  @Modifying
  @Query(
      """
      UPDATE Proposal p
      SET p.closeFailures = p.closeFailures + 1, p.lastCloseFailureAt = :now
      WHERE p.id = :id
        AND p.status = io.forgecascade.governance.proposal.ProposalStatus.ACTIVE
      """)
  int recordCloseFailure(@Param("id") UUID id, @Param("now") Instant now);

  List<Proposal> findByStatusOrderByVotingEndsAtAsc(ProposalStatus status);

  /** Oldest execution first, so later proposals are applied over earlier ones. */
  List<Proposal> findByTypeAndStatusOrderByExecutedAtAscIdAsc(
      ProposalType type, ProposalStatus status);

  @Query(
      """
      SELECT p FROM Proposal p
      WHERE (:status IS NULL OR p.status = :status)
        AND (:type IS NULL OR p.type = :type)
        AND (:proposerId IS NULL OR p.proposerId = :proposerId)
      ORDER BY p.createdAt DESC
      """)
  Page<Proposal> findFiltered(
      @Param("status") ProposalStatus status,
      @Param("type") ProposalType type,
      @Param("proposerId") UUID proposerId,
      Pageable pageable);

  interface StatusCount {
    ProposalStatus getStatus();

    long getCount();
  }

  @Query("SELECT p.status AS status, COUNT(p) AS count FROM Proposal p GROUP BY p.status")
  List<StatusCount> countByStatusGrouped();

  /** Mean participation over closed proposals that had an electorate. Null when there are none. */
  @Query(
      """
      SELECT AVG((p.weightFor + p.weightAgainst + p.weightAbstain) / p.totalEligibleWeight)
      FROM Proposal p
      WHERE p.closedAt IS NOT NULL
        AND p.status <> io.forgecascade.governance.proposal.ProposalStatus.WITHDRAWN
        AND p.totalEligibleWeight > 0
      """)
  Double averageParticipation();

  /** Mean for / (for + against) over closed proposals with decisive weight. */
  @Query(
      """
      SELECT AVG(p.weightFor / (p.weightFor + p.weightAgainst))
      FROM Proposal p
      WHERE p.closedAt IS NOT NULL
        AND p.status <> io.forgecascade.governance.proposal.ProposalStatus.WITHDRAWN
        AND (p.weightFor + p.weightAgainst) > 0
      """)
  Double averageApprovalRatio();
}
