package io.forgecascade.governance.vote;

import java.util.UUID;

/**
 * Published inside the vote transaction; listeners run after commit.
 *
 * @param revote true when an existing vote was revised
 */
public record VoteCastEvent(
    UUID proposalId, UUID voterId, VoteDecision decision, double weight, boolean revote) {}
