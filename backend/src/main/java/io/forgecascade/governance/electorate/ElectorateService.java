package io.forgecascade.governance.electorate;

import io.forgecascade.governance.audit.AuditEventBuilder;
import io.forgecascade.governance.audit.AuditService;
import io.forgecascade.governance.config.GovernanceProperties;
import io.forgecascade.governance.exception.ForbiddenException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ElectorateService implements VotingWeightProvider {

  private static final Logger log = LoggerFactory.getLogger(ElectorateService.class);

  /** Audit entity ID for electorate-wide events; there is no single row to point at. */
  static final UUID ELECTORATE_ENTITY_ID = new UUID(0L, 0L);

  private final ElectorMemberRepository electorMemberRepository;
  private final AuditService auditService;
  private final GovernanceProperties properties;
  private final Clock clock;

  public ElectorateService(
      ElectorMemberRepository electorMemberRepository,
      AuditService auditService,
      GovernanceProperties properties,
      Clock clock) {
    this.electorMemberRepository = electorMemberRepository;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  @Transactional(readOnly = true)
  public double currentWeight(UUID voterId) {
    var member =
        electorMemberRepository
            .findById(voterId)
            .orElseThrow(
                () ->
                    new ForbiddenException(
                        "Not eligible to vote", "Member " + voterId + " is not in the electorate"));
    if (!member.isActive()) {
      throw new ForbiddenException("Not eligible to vote", "Member " + voterId + " is inactive");
    }
    int minTrust = properties.voting().minTrustScore();
    if (member.getTrustScore() < minTrust) {
      throw new ForbiddenException(
          "Not eligible to vote",
          "Trust score " + member.getTrustScore() + " is below the voting minimum of " + minTrust);
    }
    return VotingWeights.fromTrustScore(member.getTrustScore());
  }

  @Override
  @Transactional(readOnly = true)
  public double totalEligibleWeight() {
    double total = 0.0;
    for (int trustScore :
        electorMemberRepository.findEligibleTrustScores(properties.voting().minTrustScore())) {
      total += VotingWeights.fromTrustScore(trustScore);
    }
    return total;
  }

  @Override
  @Transactional(readOnly = true)
  public long eligibleVoterCount() {
    return electorMemberRepository.countByActiveTrueAndTrustScoreGreaterThanEqual(
        properties.voting().minTrustScore());
  }

  /** True once the member has been pushed by a sync, whatever their current standing. */
  @Transactional(readOnly = true)
  public boolean isKnownMember(UUID memberId) {
    return electorMemberRepository.existsById(memberId);
  }

  /** Upserts the given standings. Members not in the batch are left untouched. */
  @Transactional
  public SyncResult sync(List<MemberStanding> standings) {
    Instant now = clock.instant();
    int created = 0;
    int updated = 0;
    for (var standing : standings) {
      var existing = electorMemberRepository.findById(standing.memberId());
      if (existing.isPresent()) {
        if (existing.get().updateStanding(standing.trustScore(), standing.active(), now)) {
          updated++;
        }
      } else {
        electorMemberRepository.save(
            new ElectorMember(standing.memberId(), standing.trustScore(), standing.active(), now));
        created++;
      }
    }

    auditService.log(
        AuditEventBuilder.of("electorate", ELECTORATE_ENTITY_ID, "synced")
            .details(
                Map.of("received", standings.size(), "created", created, "updated", updated))
            .build());

    log.info(
        "Electorate sync: received={}, created={}, updated={}", standings.size(), created, updated);
    return new SyncResult(created, updated, standings.size() - created - updated);
  }

  public record MemberStanding(UUID memberId, int trustScore, boolean active) {}

  public record SyncResult(int created, int updated, int unchanged) {}
}
