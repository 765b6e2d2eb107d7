package io.forgecascade.governance.proposal;

import io.forgecascade.governance.proposal.ProposalController.ProposalResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Callback for the external executor that applies PASSED proposals. */
@RestController
@RequestMapping("/internal/proposals")
public class ProposalExecutionController {

  private static final Logger log = LoggerFactory.getLogger(ProposalExecutionController.class);

  private final ProposalLifecycleService lifecycleService;

  public ProposalExecutionController(ProposalLifecycleService lifecycleService) {
    this.lifecycleService = lifecycleService;
  }

  @PostMapping("/{id}/execution")
  @PreAuthorize("hasRole('SYSTEM')")
  public ResponseEntity<ProposalResponse> recordExecution(
      @PathVariable UUID id, @Valid @RequestBody ExecutionRequest request) {
    log.info("Received execution report for proposal {}: success={}", id, request.success());
    var proposal =
        lifecycleService.markExecuted(
            id, new ExecutionReport(request.success(), request.resultText()));
    return ResponseEntity.ok(ProposalResponse.from(proposal));
  }

  public record ExecutionRequest(
      Boolean success,
      @Size(max = 10000, message = "resultText must be at most 10000 characters")
          String resultText) {}
}
