package io.forgecascade.governance.delegation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VoteDelegationRepository extends JpaRepository<VoteDelegation, UUID> {

  Optional<VoteDelegation> findByDelegatorIdAndDelegateId(UUID delegatorId, UUID delegateId);

  /** Delegations the member gave or received, including revoked and expired ones. */
  @Query(
      """
      SELECT d FROM VoteDelegation d
      WHERE d.delegatorId = :memberId OR d.delegateId = :memberId
      ORDER BY d.createdAt DESC, d.id ASC
      """)
  List<VoteDelegation> findInvolving(@Param("memberId") UUID memberId);

  @Query(
      """
      SELECT d FROM VoteDelegation d
      WHERE d.delegatorId = :delegatorId
        AND d.active = true
        AND (d.expiresAt IS NULL OR d.expiresAt > :now)
      ORDER BY d.createdAt ASC
      """)
  List<VoteDelegation> findEffectiveOutgoing(
      @Param("delegatorId") UUID delegatorId, @Param("now") Instant now);
}
