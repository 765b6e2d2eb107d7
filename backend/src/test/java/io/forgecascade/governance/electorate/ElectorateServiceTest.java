package io.forgecascade.governance.electorate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.forgecascade.governance.audit.AuditEventRecord;
import io.forgecascade.governance.audit.AuditService;
import io.forgecascade.governance.electorate.ElectorateService.MemberStanding;
import io.forgecascade.governance.exception.ForbiddenException;
import io.forgecascade.governance.testutil.TestGovernanceProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ElectorateServiceTest {

  private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

  @Mock private ElectorMemberRepository electorMemberRepository;
  @Mock private AuditService auditService;

  private ElectorateService service;

  @BeforeEach
  void setUp() {
    service =
        new ElectorateService(
            electorMemberRepository,
            auditService,
            TestGovernanceProperties.defaults(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private ElectorMember stubMember(int trustScore, boolean active) {
    var member = new ElectorMember(UUID.randomUUID(), trustScore, active, NOW);
    when(electorMemberRepository.findById(member.getMemberId())).thenReturn(Optional.of(member));
    return member;
  }

  @Test
  void currentWeight_eligibleMember_usesTrustCurve() {
    var member = stubMember(64, true);

    assertThat(service.currentWeight(member.getMemberId())).isCloseTo(0.512, within(1e-12));
  }

  @Test
  void currentWeight_atMinimumTrust_isEligible() {
    var member = stubMember(30, true);

    assertThat(service.currentWeight(member.getMemberId())).isPositive();
  }

  @Test
  void currentWeight_belowMinimumTrust_throwsForbidden() {
    var member = stubMember(29, true);

    assertThatThrownBy(() -> service.currentWeight(member.getMemberId()))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void currentWeight_inactiveMember_throwsForbidden() {
    var member = stubMember(90, false);

    assertThatThrownBy(() -> service.currentWeight(member.getMemberId()))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void currentWeight_unknownMember_throwsForbidden() {
    var memberId = UUID.randomUUID();
    when(electorMemberRepository.findById(memberId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.currentWeight(memberId))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void totalEligibleWeight_sumsEligibleMembers() {
    when(electorMemberRepository.findEligibleTrustScores(30)).thenReturn(List.of(100, 64, 36));

    assertThat(service.totalEligibleWeight()).isCloseTo(1.0 + 0.512 + 0.216, within(1e-9));
  }

  @Test
  void eligibleVoterCount_usesMinimumTrustScore() {
    when(electorMemberRepository.countByActiveTrueAndTrustScoreGreaterThanEqual(30)).thenReturn(7L);

    assertThat(service.eligibleVoterCount()).isEqualTo(7);
  }

  @Test
  void isKnownMember_includesInactiveAndLowTrustMembers() {
    var lowTrust = UUID.randomUUID();
    var stranger = UUID.randomUUID();
    when(electorMemberRepository.existsById(lowTrust)).thenReturn(true);
    when(electorMemberRepository.existsById(stranger)).thenReturn(false);

    assertThat(service.isKnownMember(lowTrust)).isTrue();
    assertThat(service.isKnownMember(stranger)).isFalse();
  }

  @Test
  void totalEligibleWeight_emptyElectorate_isZero() {
    when(electorMemberRepository.findEligibleTrustScores(30)).thenReturn(List.of());

    assertThat(service.totalEligibleWeight()).isZero();
  }

  @Test
  void sync_createsUpdatesAndCountsUnchanged() {
    var unchanged = stubMember(50, true);
    var changed = stubMember(50, true);
    var newMemberId = UUID.randomUUID();
    when(electorMemberRepository.findById(newMemberId)).thenReturn(Optional.empty());

    var result =
        service.sync(
            List.of(
                new MemberStanding(unchanged.getMemberId(), 50, true),
                new MemberStanding(changed.getMemberId(), 80, false),
                new MemberStanding(newMemberId, 40, true)));

    assertThat(result).isEqualTo(new ElectorateService.SyncResult(1, 1, 1));
    assertThat(changed.getTrustScore()).isEqualTo(80);
    assertThat(changed.isActive()).isFalse();
    verify(electorMemberRepository).save(any(ElectorMember.class));

    var audit = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(audit.capture());
    assertThat(audit.getValue().eventType()).isEqualTo("electorate.synced");
    assertThat(audit.getValue().details()).containsEntry("received", 3);
  }
}
