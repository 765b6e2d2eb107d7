package io.forgecascade.governance.policy;

import io.forgecascade.governance.exception.ResourceNotFoundException;
import io.forgecascade.governance.proposal.Proposal;
import io.forgecascade.governance.proposal.ProposalPayloadValidator;
import io.forgecascade.governance.proposal.ProposalRepository;
import io.forgecascade.governance.proposal.ProposalStatus;
import io.forgecascade.governance.proposal.ProposalType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Replays executed POLICY proposals in execution order to work out which policies are in force.
 *
 * <ul>
 *   <li>{@code create_policy} enacts a policy identified by the proposal's ID.
 *   <li>{@code update_policy} merges {@code changes} into the rules of {@code policy_id}.
 *   <li>{@code remove_policy} repeals {@code policy_id}.
 *   <li>A POLICY proposal without an action enacts its payload as the rules, under its title.
 * </ul>
 *
 * Amendments and repeals naming a policy that is not in force are skipped.
 */
@Service
public class PolicyService {

  private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

  private final ProposalRepository proposalRepository;

  public PolicyService(ProposalRepository proposalRepository) {
    this.proposalRepository = proposalRepository;
  }

  @Transactional(readOnly = true)
  public List<ActivePolicy> listActivePolicies() {
    var inForce = new LinkedHashMap<UUID, PolicyState>();
    for (var proposal :
        proposalRepository.findByTypeAndStatusOrderByExecutedAtAscIdAsc(
            ProposalType.POLICY, ProposalStatus.EXECUTED)) {
      apply(inForce, proposal);
    }
    return inForce.values().stream().map(PolicyState::toPolicy).toList();
  }

  @Transactional(readOnly = true)
  public ActivePolicy getPolicy(UUID policyId) {
    return listActivePolicies().stream()
        .filter(policy -> policy.id().equals(policyId))
        .findFirst()
        .orElseThrow(() -> new ResourceNotFoundException("Policy", policyId));
  }

  private static void apply(Map<UUID, PolicyState> inForce, Proposal proposal) {
    var payload = proposal.getPayload();
    Object action = payload.get(ProposalPayloadValidator.ACTION_KEY);
    if (action == null) {
      inForce.put(
          proposal.getId(),
          new PolicyState(
              proposal.getId(), proposal.getTitle(), payload, proposal.getExecutedAt()));
      return;
    }
    switch (action.toString()) {
      case "create_policy" ->
          inForce.put(
              proposal.getId(),
              new PolicyState(
                  proposal.getId(),
                  String.valueOf(payload.get("name")),
                  payload.get("rules"),
                  proposal.getExecutedAt()));
      case "update_policy" -> {
        var target = inForce.get(policyId(payload));
        if (target == null) {
          log.debug("Proposal {} amends a policy that is not in force", proposal.getId());
          return;
        }
        target.amend(proposal.getId(), payload.get("changes"), proposal.getExecutedAt());
      }
      case "remove_policy" -> {
        if (inForce.remove(policyId(payload)) == null) {
          log.debug("Proposal {} repeals a policy that is not in force", proposal.getId());
        }
      }
      default -> log.debug("Ignoring policy action {} on proposal {}", action, proposal.getId());
    }
  }

  private static UUID policyId(Map<String, Object> payload) {
    Object raw = payload.get("policy_id");
    if (raw == null) {
      return null;
    }
    try {
      return UUID.fromString(raw.toString());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static final class PolicyState {

    private final UUID id;
    private final String name;
    private final Instant enactedAt;
    private final List<UUID> amendedBy = new ArrayList<>();
    private Object rules;
    private Instant lastChangedAt;

    private PolicyState(UUID id, String name, Object rules, Instant enactedAt) {
      this.id = id;
      this.name = name;
      this.rules = rules;
      this.enactedAt = enactedAt;
      this.lastChangedAt = enactedAt;
    }

    /** Map changes are merged key by key; anything else replaces the rules outright. */
    private void amend(UUID proposalId, Object changes, Instant executedAt) {
      if (rules instanceof Map<?, ?> current && changes instanceof Map<?, ?> delta) {
        var merged = new LinkedHashMap<Object, Object>(current);
        merged.putAll(delta);
        rules = merged;
      } else {
        rules = changes;
      }
      amendedBy.add(proposalId);
      lastChangedAt = executedAt;
    }

    private ActivePolicy toPolicy() {
      Object view = rules instanceof Map<?, ?> map ? Collections.unmodifiableMap(map) : rules;
      return new ActivePolicy(id, name, view, enactedAt, List.copyOf(amendedBy), lastChangedAt);
    }
  }
}
