package io.forgecascade.governance.config;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for the governance engine, bound from the {@code governance.*} namespace.
 *
 * @param voting defaults and bounds applied when proposals are created and activated
 * @param execution settings for recording the outcome of passed proposals
 * @param deadline settings for the background sweep that closes proposals past their deadline
 */
@ConfigurationProperties(prefix = "governance")
public record GovernanceProperties(
    @DefaultValue Voting voting,
    @DefaultValue Execution execution,
    @DefaultValue Deadline deadline) {

  /**
   * @param defaultQuorumPercentage share of total eligible weight that must participate
   * @param defaultApprovalThreshold share of decisive (FOR + AGAINST) weight needed to pass
   * @param defaultPeriod voting period used when activation does not supply one
   * @param maxPeriod longest voting period accepted at activation
   * @param minTrustScore trust score a member needs to count towards the electorate
   */
  public record Voting(
      @DefaultValue("0.30") BigDecimal defaultQuorumPercentage,
      @DefaultValue("0.50") BigDecimal defaultApprovalThreshold,
      @DefaultValue("P7D") Duration defaultPeriod,
      @DefaultValue("P30D") Duration maxPeriod,
      @DefaultValue("30") int minTrustScore) {}

  /** @param timelock delay after a proposal passes before its execution may be recorded */
  public record Execution(@DefaultValue("PT0S") Duration timelock) {}

  /**
   * @param sweepInterval delay between two deadline sweeps
   * @param batchSize maximum number of due proposals picked up by one sweep
   * @param maxSweepDuration wall-clock budget of one sweep; remaining proposals wait for the next
   */
  public record Deadline(
      @DefaultValue("PT1M") Duration sweepInterval,
      @DefaultValue("100") int batchSize,
      @DefaultValue("PT30S") Duration maxSweepDuration) {}
}
