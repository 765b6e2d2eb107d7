package io.forgecascade.governance.vote;

import io.forgecascade.governance.security.CurrentActor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class VoteController {

  private final VoteService voteService;

  public VoteController(VoteService voteService) {
    this.voteService = voteService;
  }

  /** 201 for a first vote, 200 for a revote. */
  @PostMapping("/api/proposals/{proposalId}/votes")
  @PreAuthorize("hasAnyRole('STANDARD', 'TRUSTED', 'CORE', 'ADMIN', 'SYSTEM')")
  public ResponseEntity<VoteResponse> castVote(
      @PathVariable UUID proposalId, @Valid @RequestBody CastVoteRequest request) {
    UUID voterId = CurrentActor.requireActorId();
    var decision = VoteDecision.fromString(request.decision());
    var result = voteService.castVote(proposalId, voterId, decision, request.reasoning());
    if (result.revote()) {
      return ResponseEntity.ok(VoteResponse.from(result.vote()));
    }
    return ResponseEntity.status(HttpStatus.CREATED)
        .location(URI.create("/api/proposals/" + proposalId + "/votes/mine"))
        .body(VoteResponse.from(result.vote()));
  }

  @GetMapping("/api/proposals/{proposalId}/votes")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<VoteResponse>> listVotes(@PathVariable UUID proposalId) {
    return ResponseEntity.ok(
        voteService.listVotes(proposalId).stream().map(VoteResponse::from).toList());
  }

  @GetMapping("/api/proposals/{proposalId}/votes/mine")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<VoteResponse> getMyVote(@PathVariable UUID proposalId) {
    var vote = voteService.requireVote(proposalId, CurrentActor.requireActorId());
    return ResponseEntity.ok(VoteResponse.from(vote));
  }

  @GetMapping("/api/voters/me/votes")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<Page<VoteResponse>> getMyVotingHistory(Pageable pageable) {
    var page = voteService.listVoterHistory(CurrentActor.requireActorId(), pageable);
    return ResponseEntity.ok(page.map(VoteResponse::from));
  }

  /** Decision is a string so aliases and unknown values reach {@link VoteDecision#fromString}. */
  public record CastVoteRequest(
      @NotBlank(message = "decision is required") String decision,
      @Size(max = 5000, message = "reasoning must be at most 5000 characters") String reasoning) {}

  public record VoteResponse(
      UUID id,
      UUID proposalId,
      UUID voterId,
      VoteDecision decision,
      double weight,
      String reasoning,
      Instant createdAt,
      Instant updatedAt) {

    public static VoteResponse from(Vote vote) {
      return new VoteResponse(
          vote.getId(),
          vote.getProposalId(),
          vote.getVoterId(),
          vote.getDecision(),
          vote.getWeight(),
          vote.getReasoning(),
          vote.getCreatedAt(),
          vote.getUpdatedAt());
    }
  }
}
