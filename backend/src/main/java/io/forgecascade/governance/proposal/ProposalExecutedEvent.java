package io.forgecascade.governance.proposal;

import java.time.Instant;
import java.util.UUID;

public record ProposalExecutedEvent(UUID proposalId, ProposalStatus outcome, Instant executedAt) {}
