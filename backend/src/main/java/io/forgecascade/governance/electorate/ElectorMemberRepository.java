package io.forgecascade.governance.electorate;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ElectorMemberRepository extends JpaRepository<ElectorMember, UUID> {

  @Query(
      "SELECT m.trustScore FROM ElectorMember m"
          + " WHERE m.active = true AND m.trustScore >= :minTrustScore")
  List<Integer> findEligibleTrustScores(@Param("minTrustScore") int minTrustScore);

  long countByActiveTrueAndTrustScoreGreaterThanEqual(int minTrustScore);
}
