package io.forgecascade.governance.electorate;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/electorate")
public class ElectorateSyncController {

  private static final Logger log = LoggerFactory.getLogger(ElectorateSyncController.class);

  private final ElectorateService electorateService;

  public ElectorateSyncController(ElectorateService electorateService) {
    this.electorateService = electorateService;
  }

  @PostMapping("/sync")
  @PreAuthorize("hasRole('SYSTEM')")
  public ResponseEntity<SyncResponse> sync(@Valid @RequestBody SyncRequest request) {
    log.info("Received electorate sync: members={}", request.members().size());

    var result =
        electorateService.sync(
            request.members().stream()
                .map(
                    m ->
                        new ElectorateService.MemberStanding(
                            m.memberId(), m.trustScore(), m.active()))
                .toList());

    return ResponseEntity.ok(
        new SyncResponse(
            result.created(),
            result.updated(),
            result.unchanged(),
            electorateService.totalEligibleWeight()));
  }

  public record SyncRequest(
      @NotEmpty(message = "members is required") List<@Valid MemberEntry> members) {}

  public record MemberEntry(
      @NotNull(message = "memberId is required") UUID memberId,
      @Min(value = 0, message = "trustScore must be between 0 and 100")
          @Max(value = 100, message = "trustScore must be between 0 and 100")
          int trustScore,
      boolean active) {}

  public record SyncResponse(int created, int updated, int unchanged, double totalEligibleWeight) {}
}
