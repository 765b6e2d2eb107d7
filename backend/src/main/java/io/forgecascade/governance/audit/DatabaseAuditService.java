package io.forgecascade.governance.audit;

import io.forgecascade.governance.exception.ResourceNotFoundException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final Clock clock;

  public DatabaseAuditService(AuditEventRepository auditEventRepository, Clock clock) {
    this.auditEventRepository = auditEventRepository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    auditEventRepository.save(new AuditEvent(record, clock.instant()));
    log.debug(
        "Audit {} on {} {} by {} {} via {}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorKind(),
        record.actorId(),
        record.origin());
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable) {
    return auditEventRepository.findByFilter(
        filter.proposalId(),
        filter.entityType(),
        filter.actorId(),
        filter.actorKind(),
        filter.eventType(),
        filter.from(),
        filter.to(),
        pageable);
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> proposalHistory(UUID proposalId) {
    var events = auditEventRepository.findByProposalIdOrderByOccurredAtAscIdAsc(proposalId);
    if (events.isEmpty()) {
      throw new ResourceNotFoundException("Proposal", proposalId);
    }
    return events;
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEventRepository.EventTypeCount> countEventsByType() {
    return auditEventRepository.countByEventType();
  }
}
