package io.forgecascade.governance.vote;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VoteRepository extends JpaRepository<Vote, UUID> {

  interface DecisionSum {
    VoteDecision getDecision();

    long getVoteCount();

    Double getTotalWeight();
  }

  /** One row per decision present on the proposal. Absent decisions mean zero. */
  @Query(
      """
      SELECT v.decision AS decision, COUNT(v) AS voteCount, SUM(v.weight) AS totalWeight
      FROM Vote v
      WHERE v.proposalId = :proposalId
      GROUP BY v.decision
      """)
  List<DecisionSum> sumByDecision(@Param("proposalId") UUID proposalId);

  Optional<Vote> findByProposalIdAndVoterId(UUID proposalId, UUID voterId);

  /** Creation order, ties broken by ID so paging is stable. */
  List<Vote> findByProposalIdOrderByCreatedAtAscIdAsc(UUID proposalId);

  Page<Vote> findByVoterIdOrderByUpdatedAtDesc(UUID voterId, Pageable pageable);

  long countByProposalId(UUID proposalId);

  @Query("SELECT COUNT(DISTINCT v.voterId) FROM Vote v")
  long countDistinctVoters();
}
