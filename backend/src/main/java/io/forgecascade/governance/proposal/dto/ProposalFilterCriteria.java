package io.forgecascade.governance.proposal.dto;

import io.forgecascade.governance.proposal.ProposalStatus;
import io.forgecascade.governance.proposal.ProposalType;
import java.util.UUID;

public record ProposalFilterCriteria(ProposalStatus status, ProposalType type, UUID proposerId) {}
