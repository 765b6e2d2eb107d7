package io.forgecascade.governance.security;

/**
 * Centralized role constants used across authentication and authorization.
 *
 * <p>Trust roles come from the {@code role} claim of the access token. Spring authorities are the
 * {@code ROLE_} prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // Trust levels, lowest first ("role" claim values)
  public static final String QUARANTINE = "QUARANTINE";
  public static final String SANDBOX = "SANDBOX";
  public static final String STANDARD = "STANDARD";
  public static final String TRUSTED = "TRUSTED";
  public static final String CORE = "CORE";
  public static final String ADMIN = "ADMIN";
  public static final String SYSTEM = "SYSTEM";

  // Spring Security granted authorities
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_SYSTEM = "ROLE_SYSTEM";

  private Roles() {}
}
