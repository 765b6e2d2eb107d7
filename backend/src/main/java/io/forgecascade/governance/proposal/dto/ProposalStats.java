package io.forgecascade.governance.proposal.dto;

import io.forgecascade.governance.proposal.ProposalStatus;
import java.util.Map;

/**
 * @param eligibleVoters members allowed to vote right now
 * @param averageParticipation participation weight / electorate, averaged over closed proposals
 * @param averageApprovalRatio for / (for + against), averaged over closed proposals with decisive
 *     weight
 */
public record ProposalStats(
    long totalProposals,
    Map<ProposalStatus, Long> byStatus,
    long totalVotes,
    long uniqueVoters,
    long eligibleVoters,
    double averageParticipation,
    double averageApprovalRatio) {}
