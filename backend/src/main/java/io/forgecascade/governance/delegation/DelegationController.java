package io.forgecascade.governance.delegation;

import io.forgecascade.governance.proposal.ProposalType;
import io.forgecascade.governance.security.CurrentActor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/delegations")
public class DelegationController {

  private final DelegationService delegationService;

  public DelegationController(DelegationService delegationService) {
    this.delegationService = delegationService;
  }

  /** 201 for a new pair, 200 when an existing delegation to the same member is renewed. */
  @PostMapping
  @PreAuthorize("hasAnyRole('STANDARD', 'TRUSTED', 'CORE', 'ADMIN', 'SYSTEM')")
  public ResponseEntity<DelegationResponse> delegate(
      @Valid @RequestBody CreateDelegationRequest request) {
    var result =
        delegationService.delegate(
            CurrentActor.requireActorId(),
            request.delegateId(),
            request.proposalTypes(),
            request.expiresAt());
    var body = DelegationResponse.from(result.delegation());
    if (!result.created()) {
      return ResponseEntity.ok(body);
    }
    return ResponseEntity.status(HttpStatus.CREATED)
        .location(URI.create("/api/delegations/" + body.id()))
        .body(body);
  }

  @GetMapping
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<DelegationResponse>> listMine() {
    return ResponseEntity.ok(
        delegationService.listInvolving(CurrentActor.requireActorId()).stream()
            .map(DelegationResponse::from)
            .toList());
  }

  @GetMapping("/outgoing")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<DelegationResponse>> listEffectiveOutgoing(
      @RequestParam(required = false) ProposalType proposalType) {
    return ResponseEntity.ok(
        delegationService
            .effectiveDelegations(CurrentActor.requireActorId(), proposalType)
            .stream()
            .map(DelegationResponse::from)
            .toList());
  }

  @DeleteMapping("/{delegationId}")
  @PreAuthorize("hasAnyRole('STANDARD', 'TRUSTED', 'CORE', 'ADMIN', 'SYSTEM')")
  public ResponseEntity<DelegationResponse> revoke(@PathVariable UUID delegationId) {
    var delegation = delegationService.revoke(delegationId, CurrentActor.requireActorId());
    return ResponseEntity.ok(DelegationResponse.from(delegation));
  }

  /** Omit or empty {@code proposalTypes} to cover every type. */
  public record CreateDelegationRequest(
      @NotNull(message = "delegateId is required") UUID delegateId,
      Set<ProposalType> proposalTypes,
      Instant expiresAt) {}

  public record DelegationResponse(
      UUID id,
      UUID delegatorId,
      UUID delegateId,
      Set<ProposalType> proposalTypes,
      boolean active,
      Instant expiresAt,
      Instant revokedAt,
      Instant createdAt,
      Instant updatedAt) {

    public static DelegationResponse from(VoteDelegation delegation) {
      return new DelegationResponse(
          delegation.getId(),
          delegation.getDelegatorId(),
          delegation.getDelegateId(),
          delegation.getProposalTypes(),
          delegation.isActive(),
          delegation.getExpiresAt(),
          delegation.getRevokedAt(),
          delegation.getCreatedAt(),
          delegation.getUpdatedAt());
    }
  }
}
