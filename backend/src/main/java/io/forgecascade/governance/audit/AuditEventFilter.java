package io.forgecascade.governance.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Null fields match everything.
 *
 * @param eventType prefix match, so "vote." selects vote.cast and vote.changed
 * @param to exclusive
 */
public record AuditEventFilter(
    UUID proposalId,
    String entityType,
    UUID actorId,
    String eventType,
    ActorKind actorKind,
    Instant from,
    Instant to) {}
