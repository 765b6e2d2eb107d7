package io.forgecascade.governance.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private static final int MAX_PAGE_SIZE = 200;

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  /** Full trail, operators only. */
  @GetMapping("/api/audit-events")
  @PreAuthorize("hasAnyRole('ADMIN', 'SYSTEM')")
  public ResponseEntity<Page<AuditEventResponse>> listAuditEvents(
      @RequestParam(required = false) UUID proposalId,
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) UUID actorId,
      @RequestParam(required = false) String eventType,
      @RequestParam(required = false) ActorKind actorKind,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var filter =
        new AuditEventFilter(proposalId, entityType, actorId, eventType, actorKind, from, to);
    var events =
        auditService.findEvents(filter, PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE)));
    return ResponseEntity.ok(events.map(AuditEventResponse::from));
  }

  /** Open to any signed-in member. */
  @GetMapping("/api/proposals/{proposalId}/history")
  public ResponseEntity<List<HistoryEntry>> proposalHistory(@PathVariable UUID proposalId) {
    return ResponseEntity.ok(
        auditService.proposalHistory(proposalId).stream().map(HistoryEntry::from).toList());
  }

  @GetMapping("/api/audit-events/stats")
  @PreAuthorize("hasAnyRole('ADMIN', 'SYSTEM')")
  public ResponseEntity<List<AuditEventRepository.EventTypeCount>> countByType() {
    return ResponseEntity.ok(auditService.countEventsByType());
  }

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      UUID proposalId,
      UUID actorId,
      ActorKind actorKind,
      AuditOrigin origin,
      Map<String, Object> details,
      Instant occurredAt) {

    static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getProposalId(),
          event.getActorId(),
          event.getActorKind(),
          event.getOrigin(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }

  public record HistoryEntry(
      String eventType,
      UUID actorId,
      ActorKind actorKind,
      Map<String, Object> details,
      Instant occurredAt) {

    static HistoryEntry from(AuditEvent event) {
      return new HistoryEntry(
          event.getEventType(),
          event.getActorId(),
          event.getActorKind(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
