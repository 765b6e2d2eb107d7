package io.forgecascade.governance.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface AuditService {

  /** Writes in the caller's transaction; a rollback discards the event too. */
  void log(AuditEventRecord record);

  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable);

  /**
   * Proposal events and vote events on the proposal, oldest first.
   *
   * @throws io.forgecascade.governance.exception.ResourceNotFoundException if nothing was ever
   *     recorded for the proposal
   */
  List<AuditEvent> proposalHistory(UUID proposalId);

  List<AuditEventRepository.EventTypeCount> countEventsByType();
}
