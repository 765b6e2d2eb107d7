package io.forgecascade.governance.vote;

import static io.forgecascade.governance.testutil.TestProposalFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.forgecascade.governance.audit.AuditEventRecord;
import io.forgecascade.governance.audit.AuditService;
import io.forgecascade.governance.electorate.VotingWeightProvider;
import io.forgecascade.governance.exception.ElectorateWeightExceededException;
import io.forgecascade.governance.exception.ForbiddenException;
import io.forgecascade.governance.exception.ProposalNotActiveException;
import io.forgecascade.governance.exception.ResourceNotFoundException;
import io.forgecascade.governance.proposal.Proposal;
import io.forgecascade.governance.proposal.ProposalRepository;
import io.forgecascade.governance.testutil.TestProposalFactory;
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
class VoteServiceTest {

  private static final UUID PROPOSER_ID = UUID.randomUUID();
  private static final UUID VOTER_ID = UUID.randomUUID();
  private static final Instant DURING_VOTING = T0.plus(Duration.ofDays(1));

  @Mock private VoteRepository voteRepository;
  @Mock private ProposalRepository proposalRepository;
  @Mock private TallyAggregator tallyAggregator;
  @Mock private VotingWeightProvider votingWeightProvider;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private VoteService service(Instant now) {
    return new VoteService(
        voteRepository,
        proposalRepository,
        tallyAggregator,
        votingWeightProvider,
        auditService,
        eventPublisher,
        Clock.fixed(now, ZoneOffset.UTC));
  }

  private Proposal stubLocked(Proposal proposal) {
    when(proposalRepository.findByIdForUpdate(proposal.getId())).thenReturn(Optional.of(proposal));
    return proposal;
  }

  private void stubPersistence(VoteTally tally) {
    when(voteRepository.saveAndFlush(any(Vote.class))).thenAnswer(inv -> inv.getArgument(0));
    when(tallyAggregator.applyTo(any(Proposal.class))).thenReturn(tally);
  }

  @Test
  void castVote_firstVote_createsWithProviderWeight() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    when(votingWeightProvider.currentWeight(VOTER_ID)).thenReturn(0.512);
    when(voteRepository.findByProposalIdAndVoterId(proposal.getId(), VOTER_ID))
        .thenReturn(Optional.empty());
    stubPersistence(new VoteTally(1, 0, 0, 0.512, 0.0, 0.0));

    var result =
        service(DURING_VOTING).castVote(proposal.getId(), VOTER_ID, VoteDecision.FOR, "Needed");

    assertThat(result.revote()).isFalse();
    assertThat(result.vote().getDecision()).isEqualTo(VoteDecision.FOR);
    assertThat(result.vote().getWeight()).isEqualTo(0.512);
    assertThat(result.vote().getReasoning()).isEqualTo("Needed");
    assertThat(result.vote().getCreatedAt()).isEqualTo(DURING_VOTING);

    var audit = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(audit.capture());
    assertThat(audit.getValue().eventType()).isEqualTo("vote.cast");
    assertThat(audit.getValue().actorId()).isEqualTo(VOTER_ID);

    var event = ArgumentCaptor.forClass(VoteCastEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().revote()).isFalse();
  }

  @Test
  void castVote_existingVote_revisesInPlace() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    var existing = new Vote(proposal.getId(), VOTER_ID, VoteDecision.FOR, 0.3, "first", T0);
    when(voteRepository.findByProposalIdAndVoterId(proposal.getId(), VOTER_ID))
        .thenReturn(Optional.of(existing));
    stubPersistence(new VoteTally(0, 1, 0, 0.0, 0.35, 0.0));

    var result =
        service(DURING_VOTING)
            .castVote(proposal.getId(), VOTER_ID, VoteDecision.AGAINST, 0.35, "changed my mind");

    assertThat(result.revote()).isTrue();
    assertThat(result.vote()).isSameAs(existing);
    assertThat(existing.getDecision()).isEqualTo(VoteDecision.AGAINST);
    assertThat(existing.getWeight()).isEqualTo(0.35);
    assertThat(existing.getCreatedAt()).isEqualTo(T0);
    assertThat(existing.getUpdatedAt()).isEqualTo(DURING_VOTING);

    var audit = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(audit.capture());
    assertThat(audit.getValue().eventType()).isEqualTo("vote.changed");
    assertThat(audit.getValue().details()).containsEntry("previous_decision", "FOR");
  }

  @Test
  void castVote_weightBeyondElectorate_isRejectedBeforeWriting() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    proposal.applyTally(new VoteTally(1, 0, 0, 80.0, 0.0, 0.0));
    when(voteRepository.findByProposalIdAndVoterId(proposal.getId(), VOTER_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                service(DURING_VOTING)
                    .castVote(proposal.getId(), VOTER_ID, VoteDecision.FOR, 25.0, null))
        .isInstanceOf(ElectorateWeightExceededException.class)
        .extracting(e -> ((ElectorateWeightExceededException) e).getStatusCode().value())
        .isEqualTo(409);
    verify(voteRepository, never()).saveAndFlush(any());
    verifyNoInteractions(tallyAggregator, auditService, eventPublisher);
  }

  @Test
  void castVote_singleVoteLargerThanElectorate_isRejected() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    when(voteRepository.findByProposalIdAndVoterId(proposal.getId(), VOTER_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                service(DURING_VOTING)
                    .castVote(proposal.getId(), VOTER_ID, VoteDecision.FOR, 250.0, null))
        .isInstanceOf(ElectorateWeightExceededException.class);
    verify(voteRepository, never()).saveAndFlush(any());
  }

  @Test
  void castVote_fillingElectorateExactly_isAccepted() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    proposal.applyTally(new VoteTally(1, 0, 0, 80.0, 0.0, 0.0));
    when(voteRepository.findByProposalIdAndVoterId(proposal.getId(), VOTER_ID))
        .thenReturn(Optional.empty());
    stubPersistence(new VoteTally(1, 1, 0, 80.0, 20.0, 0.0));

    var result =
        service(DURING_VOTING)
            .castVote(proposal.getId(), VOTER_ID, VoteDecision.AGAINST, 20.0, null);

    assertThat(result.vote().getWeight()).isEqualTo(20.0);
  }

  @Test
  void castVote_revote_replacesOwnPreviousWeightInElectorateCheck() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));
    proposal.applyTally(new VoteTally(2, 0, 0, 90.0, 0.0, 0.0));
    var existing = new Vote(proposal.getId(), VOTER_ID, VoteDecision.FOR, 30.0, null, T0);
    when(voteRepository.findByProposalIdAndVoterId(proposal.getId(), VOTER_ID))
        .thenReturn(Optional.of(existing));
    stubPersistence(new VoteTally(2, 0, 0, 100.0, 0.0, 0.0));

    var result =
        service(DURING_VOTING).castVote(proposal.getId(), VOTER_ID, VoteDecision.FOR, 40.0, null);

    assertThat(result.revote()).isTrue();
    assertThat(existing.getWeight()).isEqualTo(40.0);
  }

  @Test
  void castVote_afterDeadline_throwsProposalNotActive() {
    var proposal = stubLocked(TestProposalFactory.active(PROPOSER_ID));

    assertThatThrownBy(
            () ->
                service(T0.plus(Duration.ofDays(7)))
                    .castVote(proposal.getId(), VOTER_ID, VoteDecision.FOR, 1.0, null))
        .isInstanceOf(ProposalNotActiveException.class);
    verify(voteRepository, never()).saveAndFlush(any());
    verifyNoInteractions(tallyAggregator, auditService, eventPublisher);
  }

  @Test
  void castVote_onDraft_throwsProposalNotActive() {
    var proposal = stubLocked(TestProposalFactory.draft(PROPOSER_ID));

    assertThatThrownBy(
            () ->
                service(DURING_VOTING)
                    .castVote(proposal.getId(), VOTER_ID, VoteDecision.ABSTAIN, 1.0, null))
        .isInstanceOf(ProposalNotActiveException.class);
  }

  @Test
  void castVote_ineligibleVoter_propagatesForbidden() {
    when(votingWeightProvider.currentWeight(VOTER_ID))
        .thenThrow(new ForbiddenException("Not eligible to vote", "inactive"));

    assertThatThrownBy(
            () ->
                service(DURING_VOTING)
                    .castVote(UUID.randomUUID(), VOTER_ID, VoteDecision.FOR, "reason"))
        .isInstanceOf(ForbiddenException.class);
    verifyNoInteractions(proposalRepository);
  }

  @Test
  void castVote_negativeWeight_isRejected() {
    assertThatThrownBy(
            () ->
                service(DURING_VOTING)
                    .castVote(UUID.randomUUID(), VOTER_ID, VoteDecision.FOR, -0.1, null))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(proposalRepository);
  }

  @Test
  void castVote_unknownProposal_throwsNotFound() {
    var id = UUID.randomUUID();
    when(proposalRepository.findByIdForUpdate(id)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service(DURING_VOTING).castVote(id, VOTER_ID, VoteDecision.FOR, 1.0, null))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void requireVote_missing_throwsNotFound() {
    var proposalId = UUID.randomUUID();
    when(voteRepository.findByProposalIdAndVoterId(proposalId, VOTER_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service(DURING_VOTING).requireVote(proposalId, VOTER_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void listVotes_unknownProposal_throwsNotFound() {
    var proposalId = UUID.randomUUID();
    when(proposalRepository.existsById(proposalId)).thenReturn(false);

    assertThatThrownBy(() -> service(DURING_VOTING).listVotes(proposalId))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
