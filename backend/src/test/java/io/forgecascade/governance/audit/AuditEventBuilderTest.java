package io.forgecascade.governance.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

class AuditEventBuilderTest {

  private static final UUID PROPOSAL_ID = UUID.randomUUID();

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
    RequestContextHolder.resetRequestAttributes();
  }

  private static void signIn(UUID memberId) {
    var jwt =
        Jwt.withTokenValue("token")
            .header("alg", "none")
            .subject(memberId.toString())
            .claim("role", "standard")
            .build();
    SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt));
  }

  @Test
  void proposal_usesProposalAsEntityAndTimelineKey() {
    var record = AuditEventBuilder.proposal(PROPOSAL_ID, "activated").build();

    assertThat(record.eventType()).isEqualTo("proposal.activated");
    assertThat(record.entityType()).isEqualTo("proposal");
    assertThat(record.entityId()).isEqualTo(PROPOSAL_ID);
    assertThat(record.proposalId()).isEqualTo(PROPOSAL_ID);
  }

  @Test
  void vote_keepsVoteAsEntityButFilesUnderProposal() {
    var voteId = UUID.randomUUID();

    var record = AuditEventBuilder.vote(voteId, PROPOSAL_ID, "changed").build();

    assertThat(record.eventType()).isEqualTo("vote.changed");
    assertThat(record.entityId()).isEqualTo(voteId);
    assertThat(record.proposalId()).isEqualTo(PROPOSAL_ID);
  }

  @Test
  void of_hasNoProposal() {
    var record = AuditEventBuilder.of("electorate", UUID.randomUUID(), "synced").build();

    assertThat(record.proposalId()).isNull();
  }

  @Test
  void build_outsideRequestWithoutToken_isInternalSystemEvent() {
    var record = AuditEventBuilder.proposal(PROPOSAL_ID, "created").build();

    assertThat(record.actorId()).isNull();
    assertThat(record.actorKind()).isEqualTo(ActorKind.SYSTEM);
    assertThat(record.origin()).isEqualTo(AuditOrigin.INTERNAL);
  }

  @Test
  void build_insideRequest_takesActorFromToken() {
    var memberId = UUID.randomUUID();
    signIn(memberId);
    RequestContextHolder.setRequestAttributes(
        new ServletRequestAttributes(new MockHttpServletRequest()));

    var record =
        AuditEventBuilder.proposal(PROPOSAL_ID, "withdrawn")
            .details(Map.of("previous_status", "ACTIVE"))
            .build();

    assertThat(record.actorId()).isEqualTo(memberId);
    assertThat(record.actorKind()).isEqualTo(ActorKind.MEMBER);
    assertThat(record.origin()).isEqualTo(AuditOrigin.API);
    assertThat(record.details()).containsEntry("previous_status", "ACTIVE");
  }

  @Test
  void actor_overridesToken() {
    signIn(UUID.randomUUID());
    var voterId = UUID.randomUUID();

    var record =
        AuditEventBuilder.vote(UUID.randomUUID(), PROPOSAL_ID, "cast").actor(voterId).build();

    assertThat(record.actorId()).isEqualTo(voterId);
    assertThat(record.actorKind()).isEqualTo(ActorKind.MEMBER);
  }

  @Test
  void scheduled_ignoresTokenAndMarksSweep() {
    signIn(UUID.randomUUID());

    var record = AuditEventBuilder.proposal(PROPOSAL_ID, "closed").scheduled().build();

    assertThat(record.actorId()).isNull();
    assertThat(record.actorKind()).isEqualTo(ActorKind.SYSTEM);
    assertThat(record.origin()).isEqualTo(AuditOrigin.SCHEDULED);
  }
}
