package io.forgecascade.governance.proposal;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a proposal leaves ACTIVE (or DRAFT, for a withdrawal). Consumed after commit.
 *
 * @param trigger "deadline", "manual" or "withdrawal"
 */
public record ProposalClosedEvent(
    UUID proposalId, ProposalStatus outcome, String trigger, Instant closedAt) {}
