package io.forgecascade.governance.proposal.dto;

import io.forgecascade.governance.proposal.ProposalType;
import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/** Optional voting settings are null when the caller wants the configured defaults. */
public record CreateProposalCommand(
    String title,
    String description,
    ProposalType type,
    Map<String, Object> payload,
    UUID proposerId,
    BigDecimal quorumPercentage,
    BigDecimal approvalThreshold,
    Integer votingPeriodDays) {}
