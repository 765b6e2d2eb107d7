package io.forgecascade.governance.policy;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A policy in force, derived from executed POLICY proposals.
 *
 * @param id the executed proposal that enacted the policy; amendments refer to it as {@code
 *     policy_id}
 * @param rules current rules after every executed amendment
 * @param amendedBy executed {@code update_policy} proposals, oldest first
 * @param lastChangedAt execution time of the enacting proposal or the latest amendment
 */
public record ActivePolicy(
    UUID id,
    String name,
    Object rules,
    Instant enactedAt,
    List<UUID> amendedBy,
    Instant lastChangedAt) {}
