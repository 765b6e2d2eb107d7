package io.forgecascade.governance.proposal;

import static io.forgecascade.governance.testutil.TestProposalFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.forgecascade.governance.audit.ActorKind;
import io.forgecascade.governance.audit.AuditEventRecord;
import io.forgecascade.governance.audit.AuditOrigin;
import io.forgecascade.governance.audit.AuditService;
import io.forgecascade.governance.config.GovernanceProperties;
import io.forgecascade.governance.electorate.VotingWeightProvider;
import io.forgecascade.governance.exception.ForbiddenException;
import io.forgecascade.governance.exception.InvalidStateException;
import io.forgecascade.governance.exception.InvalidTransitionException;
import io.forgecascade.governance.exception.ResourceNotFoundException;
import io.forgecascade.governance.testutil.TestGovernanceProperties;
import io.forgecascade.governance.testutil.TestProposalFactory;
import io.forgecascade.governance.vote.TallyAggregator;
import io.forgecascade.governance.vote.VoteTally;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class ProposalLifecycleServiceTest {

  private static final UUID PROPOSER_ID = UUID.randomUUID();
  private static final Instant AFTER_DEADLINE = T0.plus(Duration.ofDays(8));

  @Mock private ProposalRepository proposalRepository;
  @Mock private TallyAggregator tallyAggregator;
  @Mock private VotingWeightProvider votingWeightProvider;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private ProposalLifecycleService service(Instant now) {
    return service(now, TestGovernanceProperties.defaults());
  }

  private ProposalLifecycleService service(Instant now, GovernanceProperties properties) {
    return new ProposalLifecycleService(
        proposalRepository,
        tallyAggregator,
        votingWeightProvider,
        auditService,
        eventPublisher,
        properties,
        Clock.fixed(now, ZoneOffset.UTC));
  }

  private Proposal stubLocked(Proposal proposal) {
    when(proposalRepository.findByIdForUpdate(proposal.getId())).thenReturn(Optional.of(proposal));
    return proposal;
  }

  private void stubTally(Proposal proposal, VoteTally tally) {
    when(tallyAggregator.applyTo(proposal))
        .thenAnswer(
            invocation -> {
              proposal.applyTally(tally);
              return tally;
            });
  }

  private static Proposal passed(Duration timelock) {
    var proposal = TestProposalFactory.active(PROPOSER_ID);
    proposal.close(
        new VotingOutcome(ProposalStatus.PASSED, BigDecimal.TEN, true, BigDecimal.ONE),
        T0,
        timelock);
    return proposal;
  }

  // --- closeVoting ---

  @Test
  void closeVoting_quorumAndApprovalMet_passesAndPublishes() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    stubTally(proposal, new VoteTally(2, 1, 0, 35.0, 5.0, 0.0));

    var result = service(AFTER_DEADLINE).closeVoting(proposal.getId());

    assertThat(result.getStatus()).isEqualTo(ProposalStatus.PASSED);
    assertThat(result.getClosedAt()).isEqualTo(AFTER_DEADLINE);

    var captor = ArgumentCaptor.forClass(ProposalClosedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().outcome()).isEqualTo(ProposalStatus.PASSED);
    assertThat(captor.getValue().trigger()).isEqualTo("manual");
  }

  @Test
  void closeVoting_beforeDeadline_stillCloses() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    stubTally(proposal, new VoteTally(1, 4, 0, 10.0, 40.0, 0.0));

    var result = service(T0.plus(Duration.ofDays(1))).closeVoting(proposal.getId());

    assertThat(result.getStatus()).isEqualTo(ProposalStatus.REJECTED);
  }

  @Test
  void closeVoting_secondCall_isNoOp() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    stubTally(proposal, new VoteTally(1, 0, 0, 5.0, 0.0, 0.0));
    var service = service(AFTER_DEADLINE);

    var first = service.closeVoting(proposal.getId());
    var second = service.closeVoting(proposal.getId());

    assertThat(first.getStatus()).isEqualTo(ProposalStatus.EXPIRED);
    assertThat(second.getStatus()).isEqualTo(ProposalStatus.EXPIRED);
    assertThat(second.getClosedAt()).isEqualTo(AFTER_DEADLINE);
    verify(tallyAggregator, times(1)).applyTo(proposal);
    verify(auditService, times(1)).log(any());
    verify(eventPublisher, times(1)).publishEvent(any(ProposalClosedEvent.class));
  }

  @Test
  void closeVoting_draft_throwsInvalidTransition() {
    var proposal = stubLocked(TestProposalFactory.draft(PROPOSER_ID));

    assertThatThrownBy(() -> service(AFTER_DEADLINE).closeVoting(proposal.getId()))
        .isInstanceOf(InvalidTransitionException.class);
    verifyNoInteractions(tallyAggregator, auditService, eventPublisher);
  }

  @Test
  void closeVoting_unknownProposal_throwsNotFound() {
    var id = UUID.randomUUID();
    when(proposalRepository.findByIdForUpdate(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service(AFTER_DEADLINE).closeVoting(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  // --- closeVotingIfDue ---

  @Test
  void closeVotingIfDue_beforeDeadline_returnsFalse() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));

    boolean closed = service(T0.plus(Duration.ofDays(6))).closeVotingIfDue(proposal.getId());

    assertThat(closed).isFalse();
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.ACTIVE);
    verifyNoInteractions(tallyAggregator, auditService, eventPublisher);
  }

  @Test
  void closeVotingIfDue_pastDeadline_auditsAsScheduledSystemAction() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    stubTally(proposal, new VoteTally(3, 0, 0, 40.0, 0.0, 0.0));

    boolean closed = service(AFTER_DEADLINE).closeVotingIfDue(proposal.getId());

    assertThat(closed).isTrue();
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.PASSED);

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    var audit = captor.getValue();
    assertThat(audit.eventType()).isEqualTo("proposal.closed");
    assertThat(audit.actorKind()).isEqualTo(ActorKind.SYSTEM);
    assertThat(audit.actorId()).isNull();
    assertThat(audit.origin()).isEqualTo(AuditOrigin.SCHEDULED);
    assertThat(audit.proposalId()).isEqualTo(proposal.getId());
    assertThat(audit.details())
        .containsEntry("outcome", "PASSED")
        .containsEntry("trigger", "deadline")
        .containsEntry("quorum_met", true);
  }

  @Test
  void closeVotingIfDue_alreadyWithdrawn_returnsFalse() {
    var proposal = TestProposalFactory.active(PROPOSER_ID);
    proposal.withdraw(T0.plusSeconds(10));
    stubLocked(proposal);

    assertThat(service(AFTER_DEADLINE).closeVotingIfDue(proposal.getId())).isFalse();
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.WITHDRAWN);
  }

  // --- activation ---

  @Test
  void activateAs_proposer_snapshotsElectorateWeight() {
    var proposal = stubLocked(TestProposalFactory.draft(PROPOSER_ID));
    when(votingWeightProvider.totalEligibleWeight()).thenReturn(12.5);

    var result = service(T0).activateAs(proposal.getId(), PROPOSER_ID, false, null, null);

    assertThat(result.getStatus()).isEqualTo(ProposalStatus.ACTIVE);
    assertThat(result.getTotalEligibleWeight()).isEqualTo(12.5);
    assertThat(result.getVotingEndsAt()).isEqualTo(T0.plus(Duration.ofDays(7)));
  }

  @Test
  void activateAs_adminWithCustomPeriod_succeeds() {
    var proposal = stubLocked(TestProposalFactory.draft(PROPOSER_ID));
    when(votingWeightProvider.totalEligibleWeight()).thenReturn(3.0);

    var result = service(T0).activateAs(proposal.getId(), UUID.randomUUID(), true, 2, "ok");

    assertThat(result.getVotingEndsAt()).isEqualTo(T0.plus(Duration.ofDays(2)));
    assertThat(result.getAiAnalysis()).isEqualTo("ok");
  }

  @Test
  void activateAs_otherMember_throwsForbidden() {
    var proposal = stubLocked(TestProposalFactory.draft(PROPOSER_ID));

    assertThatThrownBy(
            () -> service(T0).activateAs(proposal.getId(), UUID.randomUUID(), false, null, null))
        .isInstanceOf(ForbiddenException.class);
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.DRAFT);
  }

  @Test
  void activate_periodAboveMaximum_throws() {
    var proposal = stubLocked(TestProposalFactory.draft(PROPOSER_ID));

    assertThatThrownBy(
            () -> service(T0).activate(proposal.getId(), Duration.ofDays(31), 10.0, null))
        .isInstanceOf(InvalidStateException.class);
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.DRAFT);
  }

  // --- withdrawal ---

  @Test
  void withdraw_byProposer_publishesWithdrawal() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));

    var result = service(T0.plusSeconds(60)).withdraw(proposal.getId(), PROPOSER_ID);

    assertThat(result.getStatus()).isEqualTo(ProposalStatus.WITHDRAWN);
    var captor = ArgumentCaptor.forClass(ProposalClosedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().trigger()).isEqualTo("withdrawal");
    verifyNoInteractions(tallyAggregator);
  }

  @Test
  void withdraw_byOtherMember_throwsForbidden() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));

    assertThatThrownBy(() -> service(T0).withdraw(proposal.getId(), UUID.randomUUID()))
        .isInstanceOf(ForbiddenException.class);
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.ACTIVE);
    verify(eventPublisher, never()).publishEvent(any(ProposalClosedEvent.class));
  }

  // --- execution ---

  @Test
  void markExecuted_successText_recordsExecuted() {
    var proposal = stubLocked(passed(Duration.ZERO));

    var result = service(T0.plusSeconds(5)).markExecuted(proposal.getId(), "limit raised to 25");

    assertThat(result.getStatus()).isEqualTo(ProposalStatus.EXECUTED);
    assertThat(result.getExecutionResult()).isEqualTo("limit raised to 25");
    verify(eventPublisher).publishEvent(any(ProposalExecutedEvent.class));
  }

  @Test
  void markExecuted_errorText_recordsFailed() {
    var proposal = stubLocked(passed(Duration.ZERO));

    var result = service(T0.plusSeconds(5)).markExecuted(proposal.getId(), "ERROR: config locked");

    assertThat(result.getStatus()).isEqualTo(ProposalStatus.FAILED);
  }

  @Test
  void markExecuted_withinTimelock_throwsInvalidTransition() {
    var proposal = stubLocked(passed(Duration.ofHours(24)));
    var service = service(T0.plus(Duration.ofHours(1)));

    assertThatThrownBy(() -> service.markExecuted(proposal.getId(), "done"))
        .isInstanceOf(InvalidTransitionException.class);
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.PASSED);
    verifyNoInteractions(auditService, eventPublisher);
  }

  @Test
  void markExecuted_afterTimelock_succeeds() {
    var proposal = stubLocked(passed(Duration.ofHours(24)));

    var result =
        service(T0.plus(Duration.ofHours(25)))
            .markExecuted(proposal.getId(), new ExecutionReport(true, null));

    assertThat(result.getStatus()).isEqualTo(ProposalStatus.EXECUTED);
  }

  @Test
  void markExecuted_onRejected_throwsInvalidTransition() {
    var proposal = TestProposalFactory.active(PROPOSER_ID);
    proposal.close(
        new VotingOutcome(ProposalStatus.REJECTED, BigDecimal.TEN, true, BigDecimal.ZERO),
        T0,
        Duration.ZERO);
    stubLocked(proposal);

    assertThatThrownBy(() -> service(T0).markExecuted(proposal.getId(), "done"))
        .isInstanceOf(InvalidTransitionException.class);
  }
}
