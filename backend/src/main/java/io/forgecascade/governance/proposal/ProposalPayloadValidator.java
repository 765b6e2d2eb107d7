package io.forgecascade.governance.proposal;

import io.forgecascade.governance.exception.InvalidPayloadException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Intake checks for proposal payloads. A payload without an {@code action} key is informational and
 * always accepted. The payload is never interpreted beyond these checks.
 */
public final class ProposalPayloadValidator {

  public static final String ACTION_KEY = "action";

  private static final Set<String> FORBIDDEN_KEYS =
      Set.of("__import__", "eval", "exec", "compile", "globals", "locals");

  private static final Map<ProposalType, Set<String>> ALLOWED_ACTIONS =
      Map.of(
          ProposalType.POLICY, Set.of("update_policy", "create_policy", "remove_policy"),
          ProposalType.SYSTEM,
              Set.of("update_config", "enable_feature", "disable_feature", "set_limit"),
          ProposalType.OVERLAY, Set.of("enable_overlay", "disable_overlay", "update_overlay_config"),
          ProposalType.CAPSULE, Set.of("archive", "unarchive", "change_trust", "delete", "promote"),
          ProposalType.TRUST, Set.of("adjust_trust", "set_trust_level", "reset_trust"),
          ProposalType.CONSTITUTIONAL,
              Set.of("amend_constitution", "add_principle", "remove_principle"));

  private static final Map<String, List<String>> REQUIRED_FIELDS =
      Map.ofEntries(
          Map.entry("update_policy", List.of("policy_id", "changes")),
          Map.entry("create_policy", List.of("name", "rules")),
          Map.entry("remove_policy", List.of("policy_id")),
          Map.entry("update_config", List.of("config_key", "new_value")),
          Map.entry("enable_feature", List.of("feature_name")),
          Map.entry("disable_feature", List.of("feature_name")),
          Map.entry("set_limit", List.of("limit_name", "limit_value")),
          Map.entry("enable_overlay", List.of("overlay_name")),
          Map.entry("disable_overlay", List.of("overlay_name")),
          Map.entry("update_overlay_config", List.of("overlay_name", "config")),
          Map.entry("archive", List.of("target_id")),
          Map.entry("unarchive", List.of("target_id")),
          Map.entry("change_trust", List.of("target_id", "new_trust")),
          Map.entry("delete", List.of("target_id", "reason")),
          Map.entry("promote", List.of("target_id", "new_type")),
          Map.entry("adjust_trust", List.of("user_id", "adjustment", "reason")),
          Map.entry("set_trust_level", List.of("user_id", "level")),
          Map.entry("reset_trust", List.of("user_id")),
          Map.entry("amend_constitution", List.of("article_id", "new_text")),
          Map.entry("add_principle", List.of("principle_text", "category")),
          Map.entry("remove_principle", List.of("principle_id", "justification")));

  private ProposalPayloadValidator() {}

  public static void validate(ProposalType type, Map<String, Object> payload) {
    if (payload == null || payload.isEmpty()) {
      return;
    }

    var forbidden = new TreeSet<String>();
    for (String key : payload.keySet()) {
      if (FORBIDDEN_KEYS.contains(key)) {
        forbidden.add(key);
      }
    }
    if (!forbidden.isEmpty()) {
      throw new InvalidPayloadException(
          "Invalid payload", "Payload contains forbidden keys: " + String.join(", ", forbidden));
    }

    Object action = payload.get(ACTION_KEY);
    if (action == null) {
      return;
    }
    if (!(action instanceof String actionName) || actionName.isBlank()) {
      throw new InvalidPayloadException("Invalid payload", "Payload action must be a string");
    }

    Set<String> allowed = ALLOWED_ACTIONS.get(type);
    if (!allowed.contains(actionName)) {
      throw new InvalidPayloadException(
          "Invalid payload",
          "Action '"
              + actionName
              + "' is not valid for proposal type "
              + type
              + ". Valid actions: "
              + String.join(", ", new TreeSet<>(allowed)));
    }

    List<String> missing =
        REQUIRED_FIELDS.getOrDefault(actionName, List.of()).stream()
            .filter(field -> !payload.containsKey(field))
            .toList();
    if (!missing.isEmpty()) {
      throw new InvalidPayloadException(
          "Invalid payload",
          "Action '" + actionName + "' is missing required fields: " + String.join(", ", missing));
    }
  }
}
