package io.forgecascade.governance.proposal;

import io.forgecascade.governance.proposal.dto.CreateProposalCommand;
import io.forgecascade.governance.proposal.dto.ProposalFilterCriteria;
import io.forgecascade.governance.proposal.dto.ProposalStats;
import io.forgecascade.governance.security.CurrentActor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProposalController {

  private final ProposalService proposalService;
  private final ProposalLifecycleService lifecycleService;

  public ProposalController(
      ProposalService proposalService, ProposalLifecycleService lifecycleService) {
    this.proposalService = proposalService;
    this.lifecycleService = lifecycleService;
  }

  @PostMapping("/api/proposals")
  @PreAuthorize("hasAnyRole('STANDARD', 'TRUSTED', 'CORE', 'ADMIN', 'SYSTEM')")
  public ResponseEntity<ProposalResponse> createProposal(
      @Valid @RequestBody CreateProposalRequest request) {
    UUID proposerId = CurrentActor.requireActorId();
    var proposal =
        proposalService.createProposal(
            new CreateProposalCommand(
                request.title(),
                request.description(),
                request.type(),
                request.payload(),
                proposerId,
                request.quorumPercentage(),
                request.approvalThreshold(),
                request.votingPeriodDays()));
    return ResponseEntity.created(URI.create("/api/proposals/" + proposal.getId()))
        .body(ProposalResponse.from(proposal));
  }

  @GetMapping("/api/proposals")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<Page<ProposalResponse>> listProposals(
      @RequestParam(required = false) ProposalStatus status,
      @RequestParam(required = false) ProposalType type,
      @RequestParam(required = false) UUID proposerId,
      Pageable pageable) {
    var criteria = new ProposalFilterCriteria(status, type, proposerId);
    var page = proposalService.listProposals(criteria, pageable);
    return ResponseEntity.ok(page.map(ProposalResponse::from));
  }

  @GetMapping("/api/proposals/active")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<ProposalResponse>> listActiveProposals() {
    return ResponseEntity.ok(
        proposalService.listActiveProposals().stream().map(ProposalResponse::from).toList());
  }

  @GetMapping("/api/proposals/stats")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<ProposalStats> getStats() {
    return ResponseEntity.ok(proposalService.getStats());
  }

  @GetMapping("/api/proposals/{id}")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<ProposalResponse> getProposal(@PathVariable UUID id) {
    return ResponseEntity.ok(ProposalResponse.from(proposalService.getProposal(id)));
  }

  @PutMapping("/api/proposals/{id}")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<ProposalResponse> updateProposal(
      @PathVariable UUID id, @Valid @RequestBody UpdateProposalRequest request) {
    var proposal =
        proposalService.updateProposal(
            id,
            CurrentActor.requireActorId(),
            request.title(),
            request.description(),
            request.payload());
    return ResponseEntity.ok(ProposalResponse.from(proposal));
  }

  // --- Lifecycle ---

  @PostMapping("/api/proposals/{id}/activate")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<ProposalResponse> activateProposal(
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) ActivateProposalRequest request) {
    var body = request != null ? request : new ActivateProposalRequest(null, null);
    var proposal =
        lifecycleService.activateAs(
            id,
            CurrentActor.requireActorId(),
            CurrentActor.isAdmin(),
            body.votingPeriodDays(),
            body.aiAnalysis());
    return ResponseEntity.ok(ProposalResponse.from(proposal));
  }

  @PostMapping("/api/proposals/{id}/withdraw")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<ProposalResponse> withdrawProposal(@PathVariable UUID id) {
    var proposal = lifecycleService.withdraw(id, CurrentActor.requireActorId());
    return ResponseEntity.ok(ProposalResponse.from(proposal));
  }

  @PostMapping("/api/proposals/{id}/close")
  @PreAuthorize("hasAnyRole('CORE', 'ADMIN', 'SYSTEM')")
  public ResponseEntity<ProposalResponse> closeVoting(@PathVariable UUID id) {
    return ResponseEntity.ok(ProposalResponse.from(lifecycleService.closeVoting(id)));
  }

  // --- DTOs ---

  public record CreateProposalRequest(
      @NotBlank(message = "title is required")
          @Size(min = 5, max = 200, message = "title must be between 5 and 200 characters")
          String title,
      @NotBlank(message = "description is required")
          @Size(
              min = 20,
              max = 10000,
              message = "description must be between 20 and 10000 characters")
          String description,
      @NotNull(message = "type is required") ProposalType type,
      Map<String, Object> payload,
      @DecimalMin(value = "0.01", message = "quorumPercentage must be at least 0.01")
          @DecimalMax(value = "1.0", message = "quorumPercentage must be at most 1.0")
          BigDecimal quorumPercentage,
      @DecimalMin(value = "0.5", message = "approvalThreshold must be at least 0.5")
          @DecimalMax(value = "1.0", message = "approvalThreshold must be at most 1.0")
          BigDecimal approvalThreshold,
      @Min(value = 1, message = "votingPeriodDays must be at least 1")
          @Max(value = 30, message = "votingPeriodDays must be at most 30")
          Integer votingPeriodDays) {}

  public record UpdateProposalRequest(
      @Size(min = 5, max = 200, message = "title must be between 5 and 200 characters")
          String title,
      @Size(
              min = 20,
              max = 10000,
              message = "description must be between 20 and 10000 characters")
          String description,
      Map<String, Object> payload) {}

  public record ActivateProposalRequest(
      @Min(value = 1, message = "votingPeriodDays must be at least 1")
          @Max(value = 30, message = "votingPeriodDays must be at most 30")
          Integer votingPeriodDays,
      String aiAnalysis) {}

  public record ProposalResponse(
      UUID id,
      String title,
      String description,
      ProposalType type,
      ProposalStatus status,
      Map<String, Object> payload,
      UUID proposerId,
      int votingPeriodDays,
      BigDecimal quorumPercentage,
      BigDecimal approvalThreshold,
      int votesFor,
      int votesAgainst,
      int votesAbstain,
      double weightFor,
      double weightAgainst,
      double weightAbstain,
      double totalEligibleWeight,
      Instant votingStartsAt,
      Instant votingEndsAt,
      Instant closedAt,
      Instant executionAllowedAfter,
      Instant executedAt,
      String executionResult,
      String aiAnalysis,
      Instant createdAt,
      Instant updatedAt) {

    public static ProposalResponse from(Proposal proposal) {
      return new ProposalResponse(
          proposal.getId(),
          proposal.getTitle(),
          proposal.getDescription(),
          proposal.getType(),
          proposal.getStatus(),
          proposal.getPayload(),
          proposal.getProposerId(),
          proposal.getVotingPeriodDays(),
          proposal.getQuorumPercentage(),
          proposal.getApprovalThreshold(),
          proposal.getVotesFor(),
          proposal.getVotesAgainst(),
          proposal.getVotesAbstain(),
          proposal.getWeightFor(),
          proposal.getWeightAgainst(),
          proposal.getWeightAbstain(),
          proposal.getTotalEligibleWeight(),
          proposal.getVotingStartsAt(),
          proposal.getVotingEndsAt(),
          proposal.getClosedAt(),
          proposal.getExecutionAllowedAfter(),
          proposal.getExecutedAt(),
          proposal.getExecutionResult(),
          proposal.getAiAnalysis(),
          proposal.getCreatedAt(),
          proposal.getUpdatedAt());
    }
  }
}
