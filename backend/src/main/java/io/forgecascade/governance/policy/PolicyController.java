package io.forgecascade.governance.policy;

import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/policies")
public class PolicyController {

  private final PolicyService policyService;

  public PolicyController(PolicyService policyService) {
    this.policyService = policyService;
  }

  @GetMapping
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<ActivePolicy>> listActivePolicies() {
    return ResponseEntity.ok(policyService.listActivePolicies());
  }

  @GetMapping("/{policyId}")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<ActivePolicy> getPolicy(@PathVariable UUID policyId) {
    return ResponseEntity.ok(policyService.getPolicy(policyId));
  }
}
