package io.forgecascade.governance.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  interface EventTypeCount {
    String getEventType();

    long getCount();
  }

  // Strings and timestamps are cast so PostgreSQL can type a null parameter.
  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE (:proposalId IS NULL OR e.proposalId = :proposalId)
        AND (:entityType IS NULL OR e.entityType = :entityType)
        AND (:actorId IS NULL OR e.actorId = :actorId)
        AND (:actorKind IS NULL OR e.actorKind = :actorKind)
        AND (CAST(:eventTypePrefix AS string) IS NULL OR e.eventType LIKE CONCAT(CAST(:eventTypePrefix AS string), '%'))
        AND (CAST(:from AS timestamp) IS NULL OR e.occurredAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.occurredAt < :to)
      ORDER BY e.occurredAt DESC
      """)
  Page<AuditEvent> findByFilter(
      @Param("proposalId") UUID proposalId,
      @Param("entityType") String entityType,
      @Param("actorId") UUID actorId,
      @Param("actorKind") ActorKind actorKind,
      @Param("eventTypePrefix") String eventTypePrefix,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  /** Everything that happened to a proposal and its votes, oldest first. */
  List<AuditEvent> findByProposalIdOrderByOccurredAtAscIdAsc(UUID proposalId);

  @Query(
      "SELECT e.eventType AS eventType, COUNT(e) AS count FROM AuditEvent e"
          + " GROUP BY e.eventType ORDER BY COUNT(e) DESC")
  List<EventTypeCount> countByEventType();
}
