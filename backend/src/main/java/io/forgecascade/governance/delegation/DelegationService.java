package io.forgecascade.governance.delegation;

import io.forgecascade.governance.audit.AuditEventBuilder;
import io.forgecascade.governance.audit.AuditService;
import io.forgecascade.governance.electorate.ElectorateService;
import io.forgecascade.governance.exception.ForbiddenException;
import io.forgecascade.governance.exception.InvalidStateException;
import io.forgecascade.governance.exception.ResourceNotFoundException;
import io.forgecascade.governance.proposal.ProposalType;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DelegationService {

  private static final Logger log = LoggerFactory.getLogger(DelegationService.class);

  private final VoteDelegationRepository delegationRepository;
  private final ElectorateService electorateService;
  private final AuditService auditService;
  private final Clock clock;

  public DelegationService(
      VoteDelegationRepository delegationRepository,
      ElectorateService electorateService,
      AuditService auditService,
      Clock clock) {
    this.delegationRepository = delegationRepository;
    this.electorateService = electorateService;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Records that {@code delegatorId} delegates to {@code delegateId}. An existing row for the pair,
   * revoked or not, is renewed with the new scope and expiry.
   *
   * @param proposalTypes types covered; null or empty for all
   * @param expiresAt null for no expiry; otherwise must be in the future
   */
  @Transactional
  public DelegationResult delegate(
      UUID delegatorId, UUID delegateId, Set<ProposalType> proposalTypes, Instant expiresAt) {
    if (delegatorId.equals(delegateId)) {
      throw new InvalidStateException("Invalid delegation", "Cannot delegate to yourself");
    }
    Instant now = clock.instant();
    if (expiresAt != null && !expiresAt.isAfter(now)) {
      throw new InvalidStateException(
          "Invalid delegation", "Expiry must be in the future, got " + expiresAt);
    }
    if (!electorateService.isKnownMember(delegateId)) {
      throw new ResourceNotFoundException("Member", delegateId);
    }

    var existing = delegationRepository.findByDelegatorIdAndDelegateId(delegatorId, delegateId);
    VoteDelegation delegation;
    if (existing.isPresent()) {
      delegation = existing.get();
      delegation.renew(proposalTypes, expiresAt, now);
    } else {
      delegation =
          delegationRepository.save(
              new VoteDelegation(delegatorId, delegateId, proposalTypes, expiresAt, now));
    }
    boolean created = existing.isEmpty();

    var details = new LinkedHashMap<String, Object>();
    details.put("delegate_id", delegateId.toString());
    details.put(
        "proposal_types", delegation.getProposalTypes().stream().map(Enum::name).toList());
    if (expiresAt != null) {
      details.put("expires_at", expiresAt.toString());
    }
    auditService.log(
        AuditEventBuilder.of("delegation", delegation.getId(), created ? "created" : "renewed")
            .actor(delegatorId)
            .details(details)
            .build());

    log.info(
        "{} delegation {} from {} to {}",
        created ? "Created" : "Renewed",
        delegation.getId(),
        delegatorId,
        delegateId);
    return new DelegationResult(delegation, created);
  }

  /** Only the delegator may revoke. Revoking twice is a no-op. */
  @Transactional
  public VoteDelegation revoke(UUID delegationId, UUID actorId) {
    var delegation =
        delegationRepository
            .findById(delegationId)
            .orElseThrow(() -> new ResourceNotFoundException("Delegation", delegationId));
    if (!delegation.isDelegator(actorId)) {
      throw new ForbiddenException(
          "Not the delegator", "Only the delegator can revoke delegation " + delegationId);
    }
    if (delegation.revoke(clock.instant())) {
      auditService.log(
          AuditEventBuilder.of("delegation", delegationId, "revoked").actor(actorId).build());
      log.info("Revoked delegation {} by {}", delegationId, actorId);
    }
    return delegation;
  }

  /** Newest first; the member may be on either side. */
  @Transactional(readOnly = true)
  public List<VoteDelegation> listInvolving(UUID memberId) {
    return delegationRepository.findInvolving(memberId);
  }

  /** Active, unexpired delegations from the member, optionally narrowed to one proposal type. */
  @Transactional(readOnly = true)
  public List<VoteDelegation> effectiveDelegations(UUID delegatorId, ProposalType proposalType) {
    return delegationRepository.findEffectiveOutgoing(delegatorId, clock.instant()).stream()
        .filter(d -> proposalType == null || d.covers(proposalType))
        .toList();
  }

  public record DelegationResult(VoteDelegation delegation, boolean created) {}
}
